package com.followchat.social.chat.api;

import jakarta.validation.constraints.NotBlank;

public record SendMessageRequest(
        @NotBlank(message = "receiver_username_required") String receiver_username,
        String content
) {
}
