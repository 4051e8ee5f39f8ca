package com.followchat.social.chat.ws;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.followchat.social.chat.service.AppendResult;
import com.followchat.social.chat.service.ConversationService;
import com.followchat.social.chat.service.MessageService;
import com.followchat.social.common.api.ChatError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Optional;

@Component
public class WsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsHandler.class);

    static final String PATH_PREFIX = "/ws/chat/";

    private final RoomAuthorizer roomAuthorizer;
    private final WsSessionRegistry sessionRegistry;
    private final WsBroadcaster broadcaster;
    private final OutboundEvents events;
    private final InboundFrameParser frameParser;
    private final ConversationService conversationService;
    private final MessageService messageService;
    private final MeterRegistry meterRegistry;
    private final Counter accepted;

    public WsHandler(
            RoomAuthorizer roomAuthorizer,
            WsSessionRegistry sessionRegistry,
            WsBroadcaster broadcaster,
            OutboundEvents events,
            InboundFrameParser frameParser,
            ConversationService conversationService,
            MessageService messageService,
            MeterRegistry meterRegistry
    ) {
        this.roomAuthorizer = roomAuthorizer;
        this.sessionRegistry = sessionRegistry;
        this.broadcaster = broadcaster;
        this.events = events;
        this.frameParser = frameParser;
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.meterRegistry = meterRegistry;
        this.accepted = Counter.builder("followchat.ws.connections.accepted")
                .description("Chat sockets admitted to a room")
                .register(meterRegistry);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var identity = ConnectionIdentity.from(session.getAttributes());
        var rawRoom = roomSegment(session.getUri());

        final RoomAuthorizer.Decision decision;
        try {
            decision = roomAuthorizer.authorize(identity, rawRoom);
        } catch (DataAccessException ex) {
            log.warn("ws_connect_check_failed room={} username={}", rawRoom, identity.username(), ex);
            closeQuietly(session, CloseStatus.SERVER_ERROR);
            return;
        }

        if (!decision.authorized()) {
            var reason = decision.outcome().reason();
            Counter.builder("followchat.ws.connections.rejected")
                    .description("Chat sockets closed at connect time")
                    .tag("reason", reason)
                    .register(meterRegistry)
                    .increment();
            log.info("ws_connect_rejected room={} username={} reason={}", rawRoom, identity.username(), reason);
            closeQuietly(session, decision.outcome().closeStatus());
            return;
        }

        var live = sessionRegistry.join(decision.room(), identity.username(), session);
        accepted.increment();
        log.debug("ws_connected room={} username={} connectionId={}", live.room(), live.username(), live.connectionId());
        broadcaster.broadcast(live.room(), events.userJoined(live.username()), live.username());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var live = sessionRegistry.connection(session.getId()).orElse(null);
        if (live == null) return;

        final InboundFrame frame;
        try {
            frame = frameParser.parse(message.getPayload());
        } catch (FrameRejectedException ex) {
            broadcaster.sendTo(live, events.error(ex.code(), ex.getMessage()));
            return;
        }

        Optional<ObjectNode> reply = switch (frame.type()) {
            case CHAT_MESSAGE -> onChatMessage(live, frame.content());
            case TYPING_START -> onTyping(live, true);
            case TYPING_STOP -> onTyping(live, false);
            case MARK_READ -> onMarkRead(live, frame);
        };
        reply.ifPresent(err -> broadcaster.sendTo(live, err));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionRegistry.leave(session.getId()).ifPresent(live -> {
            log.debug("ws_disconnected room={} username={} code={}", live.room(), live.username(), status.getCode());
            broadcaster.broadcast(live.room(), events.userLeft(live.username()), live.username());
        });
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error connectionId={} error={}", session.getId(), exception.toString());
        closeQuietly(session, CloseStatus.SERVER_ERROR);
    }

    private Optional<ObjectNode> onChatMessage(WsSessionRegistry.LiveConnection live, String content) {
        var room = live.room();
        final AppendResult result;
        try {
            var conversation = conversationService.getOrCreate(room.first(), room.second()).row();
            result = messageService.appendMessage(conversation, live.username(), content);
        } catch (DataAccessException ex) {
            log.warn("ws_conversation_unavailable room={}", room, ex);
            return Optional.of(events.error(ChatError.BACKEND_UNAVAILABLE));
        }

        if (result instanceof AppendResult.Appended appended) {
            broadcaster.broadcast(room, events.chatMessage(appended.message()), null);
            return Optional.empty();
        }
        if (result instanceof AppendResult.Rejected rejected) {
            return Optional.of(events.error(rejected.error()));
        }
        return Optional.of(events.error(ChatError.BACKEND_UNAVAILABLE));
    }

    private Optional<ObjectNode> onTyping(WsSessionRegistry.LiveConnection live, boolean isTyping) {
        broadcaster.broadcast(live.room(), events.typing(live.username(), isTyping), live.username());
        return Optional.empty();
    }

    private Optional<ObjectNode> onMarkRead(WsSessionRegistry.LiveConnection live, InboundFrame frame) {
        broadcaster.broadcast(live.room(), events.readReceipt(live.username(), frame.messageIds()), live.username());
        return Optional.empty();
    }

    static String roomSegment(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        var path = uri.getPath();
        var idx = path.indexOf(PATH_PREFIX);
        if (idx < 0) return null;
        var rest = path.substring(idx + PATH_PREFIX.length());
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return rest.isEmpty() || rest.contains("/") ? null : rest;
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session != null && session.isOpen()) {
                session.close(status);
            }
        } catch (Exception ex) {
            log.debug("ws_close_failed error={}", ex.toString());
        }
    }
}
