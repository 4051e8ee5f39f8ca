package com.followchat.social.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.followchat.social.chat.service.RoomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

@Component
public class WsBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(WsBroadcaster.class);

    private final ObjectMapper objectMapper;
    private final RoomFanout roomFanout;
    private final WsSessionRegistry sessionRegistry;

    public WsBroadcaster(ObjectMapper objectMapper, RoomFanout roomFanout, WsSessionRegistry sessionRegistry) {
        this.objectMapper = objectMapper;
        this.roomFanout = roomFanout;
        this.sessionRegistry = sessionRegistry;
    }

    public void broadcast(RoomId room, ObjectNode event, String excludeUsername) {
        if (room == null || event == null) return;
        final String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("ws_event_unserializable room={} type={}", room, event.path("type").asText(""), ex);
            return;
        }
        roomFanout.publish(new RoomEnvelope(room.value(), excludeUsername, payload));
    }

    public void sendTo(WsSessionRegistry.LiveConnection connection, ObjectNode event) {
        if (connection == null || event == null) return;
        try {
            sessionRegistry.send(connection, new TextMessage(objectMapper.writeValueAsString(event)));
        } catch (JsonProcessingException ex) {
            log.warn("ws_event_unserializable connectionId={}", connection.connectionId(), ex);
        }
    }
}
