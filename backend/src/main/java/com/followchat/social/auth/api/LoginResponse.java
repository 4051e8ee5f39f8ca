package com.followchat.social.auth.api;

public record LoginResponse(
        String access_token,
        long expires_in,
        String username
) {
}
