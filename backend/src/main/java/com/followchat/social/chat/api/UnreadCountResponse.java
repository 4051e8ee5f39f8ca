package com.followchat.social.chat.api;

public record UnreadCountResponse(int unread_count) {
}
