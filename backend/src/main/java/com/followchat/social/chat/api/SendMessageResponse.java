package com.followchat.social.chat.api;

public record SendMessageResponse(
        MessageItem message,
        String conversation_id,
        String room_name
) {
}
