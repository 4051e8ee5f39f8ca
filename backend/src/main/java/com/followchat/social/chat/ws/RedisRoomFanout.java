package com.followchat.social.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
@ConditionalOnProperty(name = "app.ws.fanout", havingValue = "redis")
public class RedisRoomFanout implements RoomFanout, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisRoomFanout.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final WsSessionRegistry sessionRegistry;
    private final String channel;

    public RedisRoomFanout(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            WsSessionRegistry sessionRegistry,
            @Value("${app.ws.redis-channel:followchat:room-events}") String channel
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }

    @Override
    public void publish(RoomEnvelope envelope) {
        try {
            var json = objectMapper.writeValueAsString(envelope);
            var receivers = redisTemplate.convertAndSend(channel, json);
            log.debug("room_event_published room={} receivers={}", envelope.room(), receivers);
        } catch (JsonProcessingException | DataAccessException ex) {
            // Other nodes miss this event; local members still get it.
            log.warn("room_event_publish_failed room={}", envelope.room(), ex);
            sessionRegistry.deliver(envelope.room(), envelope.payload(), envelope.exclude());
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        var body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            var envelope = objectMapper.readValue(body, RoomEnvelope.class);
            if (envelope.room() == null || envelope.payload() == null) {
                log.warn("room_event_incomplete body={}", body);
                return;
            }
            sessionRegistry.deliver(envelope.room(), envelope.payload(), envelope.exclude());
        } catch (JsonProcessingException ex) {
            log.warn("room_event_unreadable body={}", body, ex);
        }
    }
}
