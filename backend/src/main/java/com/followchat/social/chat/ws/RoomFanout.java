package com.followchat.social.chat.ws;

public interface RoomFanout {

    void publish(RoomEnvelope envelope);
}
