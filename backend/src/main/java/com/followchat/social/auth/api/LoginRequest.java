package com.followchat.social.auth.api;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "username_required") String username,
        @NotBlank(message = "password_required") String password
) {
}
