package com.followchat.social.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class InboundFrameParser {

    private final ObjectMapper objectMapper;

    public InboundFrameParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InboundFrame parse(String payload) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new FrameRejectedException("malformed_json", "Invalid JSON format", ex);
        }
        if (root == null || !root.isObject()) {
            throw new FrameRejectedException("malformed_frame", "Frame must be a JSON object");
        }

        var typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new FrameRejectedException("missing_type", "missing field: type");
        }
        var type = InboundType.fromWire(typeNode.asText())
                .orElseThrow(() -> new FrameRejectedException("unknown_type", "Unknown message type: " + typeNode.asText()));

        var names = root.fieldNames();
        while (names.hasNext()) {
            var name = names.next();
            if (!"type".equals(name) && !type.fields().contains(name)) {
                throw new FrameRejectedException("invalid_field", "unexpected field: " + name);
            }
        }

        return switch (type) {
            case CHAT_MESSAGE -> new InboundFrame(type, requireText(root, "content"), List.of());
            case TYPING_START, TYPING_STOP -> InboundFrame.of(type);
            case MARK_READ -> new InboundFrame(type, null, requireIds(root));
        };
    }

    private static String requireText(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || node.isNull()) {
            throw new FrameRejectedException("missing_field", "missing field: " + field);
        }
        if (!node.isTextual()) {
            throw new FrameRejectedException("invalid_field", "field must be a string: " + field);
        }
        return node.asText();
    }

    private static List<String> requireIds(JsonNode root) {
        var node = root.get("message_ids");
        if (node == null || node.isNull()) {
            throw new FrameRejectedException("missing_field", "missing field: message_ids");
        }
        if (!node.isArray()) {
            throw new FrameRejectedException("invalid_field", "field must be an array: message_ids");
        }
        var ids = new ArrayList<String>(node.size());
        for (var item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new FrameRejectedException("invalid_field", "message_ids must hold non-blank strings");
            }
            ids.add(item.asText());
        }
        return List.copyOf(ids);
    }
}
