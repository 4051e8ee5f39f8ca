package com.followchat.social.user.api;

public record FollowToggleResponse(boolean now_following) {
}
