package com.followchat.social.chat.api;

public record ConversationSummary(
        String id,
        ParticipantItem other_user,
        LastMessagePreview last_message,
        int unread_count,
        String room_name,
        String created_at,
        String updated_at
) {
}
