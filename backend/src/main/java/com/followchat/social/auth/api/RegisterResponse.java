package com.followchat.social.auth.api;

public record RegisterResponse(String username) {
}
