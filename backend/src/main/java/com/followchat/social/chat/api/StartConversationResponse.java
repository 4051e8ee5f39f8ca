package com.followchat.social.chat.api;

public record StartConversationResponse(
        String conversation_id,
        String room_name,
        ParticipantItem other_user,
        boolean created
) {
}
