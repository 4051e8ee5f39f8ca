package com.followchat.social.user.api;

public record UserProfileResponse(
        String username,
        String bio,
        int followers,
        int following,
        boolean is_our_profile,
        boolean following_them,
        boolean follows_you,
        boolean can_message
) {
}
