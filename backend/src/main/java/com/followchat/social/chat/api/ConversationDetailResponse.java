package com.followchat.social.chat.api;

import java.util.List;

public record ConversationDetailResponse(
        String id,
        ParticipantItem other_user,
        String room_name,
        List<MessageItem> messages,
        String created_at,
        String updated_at
) {
}
