package com.followchat.social.chat.ws;

import java.util.List;

public record InboundFrame(InboundType type, String content, List<String> messageIds) {

    public static InboundFrame of(InboundType type) {
        return new InboundFrame(type, null, List.of());
    }
}
