package com.followchat.social.chat.api;

public record LastMessagePreview(
        String content,
        String sender_username,
        String created_at
) {
}
