package com.followchat.social.chat.api;

public record ParticipantItem(
        String username,
        String bio
) {
}
