package com.followchat.social.auth.api;

public record MeResponse(
        String username,
        String bio,
        int followers,
        int following
) {
}
