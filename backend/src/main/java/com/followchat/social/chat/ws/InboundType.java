package com.followchat.social.chat.ws;

import java.util.Optional;
import java.util.Set;

public enum InboundType {

    CHAT_MESSAGE("chat_message", Set.of("content")),
    TYPING_START("typing_start", Set.of()),
    TYPING_STOP("typing_stop", Set.of()),
    MARK_READ("mark_read", Set.of("message_ids"));

    private final String wire;
    private final Set<String> fields;

    InboundType(String wire, Set<String> fields) {
        this.wire = wire;
        this.fields = fields;
    }

    public String wire() {
        return wire;
    }

    public Set<String> fields() {
        return fields;
    }

    public static Optional<InboundType> fromWire(String wire) {
        for (var t : values()) {
            if (t.wire.equals(wire)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
