package com.followchat.social.chat.ws;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.ws.fanout", havingValue = "local", matchIfMissing = true)
public class LocalRoomFanout implements RoomFanout {

    private final WsSessionRegistry sessionRegistry;

    public LocalRoomFanout(WsSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public void publish(RoomEnvelope envelope) {
        sessionRegistry.deliver(envelope.room(), envelope.payload(), envelope.exclude());
    }
}
