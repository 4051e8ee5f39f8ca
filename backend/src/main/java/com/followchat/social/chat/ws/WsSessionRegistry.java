package com.followchat.social.chat.ws;

import com.followchat.social.chat.service.RoomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class WsSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WsSessionRegistry.class);

    public record LiveConnection(String connectionId, String username, RoomId room, WebSocketSession session) {
    }

    private static final class RoomGroup {
        private final Set<LiveConnection> members = ConcurrentHashMap.newKeySet();
    }

    private final Map<String, RoomGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();

    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    public WsSessionRegistry(
            @Value("${app.ws.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-limit-bytes:524288}") int sendBufferLimitBytes
    ) {
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    public LiveConnection join(RoomId room, String username, WebSocketSession session) {
        var decorated = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferLimitBytes);
        var live = new LiveConnection(session.getId(), username, room, decorated);
        connections.put(live.connectionId(), live);
        groups.compute(room.value(), (key, group) -> {
            var next = group == null ? new RoomGroup() : group;
            next.members.add(live);
            return next;
        });
        return live;
    }

    public Optional<LiveConnection> leave(String connectionId) {
        if (connectionId == null) return Optional.empty();
        var live = connections.remove(connectionId);
        if (live == null) return Optional.empty();

        groups.computeIfPresent(live.room().value(), (key, group) -> {
            group.members.remove(live);
            return group.members.isEmpty() ? null : group;
        });
        return Optional.of(live);
    }

    public Optional<LiveConnection> connection(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Set<LiveConnection> members(RoomId room) {
        var group = groups.get(room.value());
        if (group == null) return Collections.emptySet();
        return Set.copyOf(group.members);
    }

    /**
     * Sends {@code payload} to every local member of the room except connections of
     * {@code excludeUsername}. Deliveries for one room never interleave. A failed recipient is
     * skipped.
     */
    public int deliver(String room, String payload, String excludeUsername) {
        var group = groups.get(room);
        if (group == null) return 0;

        var delivered = 0;
        var message = new TextMessage(payload);
        synchronized (group) {
            for (var member : group.members) {
                if (excludeUsername != null && excludeUsername.equals(member.username())) continue;
                if (send(member, message)) {
                    delivered++;
                }
            }
        }
        return delivered;
    }

    boolean send(LiveConnection member, TextMessage message) {
        try {
            if (!member.session().isOpen()) return false;
            member.session().sendMessage(message);
            return true;
        } catch (Exception ex) {
            log.debug("ws_send_failed connectionId={} room={} error={}", member.connectionId(), member.room(), ex.toString());
            return false;
        }
    }
}
