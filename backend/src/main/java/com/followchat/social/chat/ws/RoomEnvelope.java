package com.followchat.social.chat.ws;

public record RoomEnvelope(String room, String exclude, String payload) {
}
