package com.followchat.social.auth.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "username_required") String username,
        @NotBlank(message = "password_required") @Size(min = 8, max = 128, message = "password_length") String password,
        @Size(max = 500, message = "bio_too_long") String bio
) {
}
