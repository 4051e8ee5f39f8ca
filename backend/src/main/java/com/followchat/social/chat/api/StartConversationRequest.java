package com.followchat.social.chat.api;

import jakarta.validation.constraints.NotBlank;

public record StartConversationRequest(
        @NotBlank(message = "username_required") String username
) {
}
