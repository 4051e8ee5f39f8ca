package com.followchat.social.chat.api;

import com.followchat.social.chat.repo.MessageRepository.MessageRow;

public record MessageItem(
        String id,
        String sender_username,
        String content,
        String created_at,
        boolean is_read,
        String read_at,
        boolean is_own_message
) {
    public static MessageItem of(MessageRow row, String viewer) {
        return new MessageItem(
                row.id(),
                row.sender(),
                row.content(),
                row.createdAt().toString(),
                row.read(),
                row.readAt() == null ? null : row.readAt().toString(),
                row.sender().equals(viewer)
        );
    }
}
