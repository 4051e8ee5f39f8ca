package com.followchat.social.chat.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.followchat.social.chat.repo.MessageRepository.MessageRow;
import com.followchat.social.common.api.ChatError;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OutboundEvents {

    private final ObjectMapper objectMapper;

    public OutboundEvents(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode chatMessage(MessageRow message) {
        var evt = objectMapper.createObjectNode();
        evt.put("type", "chat_message");
        evt.put("content", message.content());
        evt.put("sender", message.sender());
        evt.put("timestamp", message.createdAt().toString());
        evt.put("message_id", message.id());
        return evt;
    }

    public ObjectNode typing(String username, boolean isTyping) {
        var evt = objectMapper.createObjectNode();
        evt.put("type", "typing");
        evt.put("username", username);
        evt.put("is_typing", isTyping);
        return evt;
    }

    public ObjectNode readReceipt(String reader, List<String> messageIds) {
        var evt = objectMapper.createObjectNode();
        evt.put("type", "read_receipt");
        evt.put("reader", reader);
        var ids = evt.putArray("message_ids");
        messageIds.forEach(ids::add);
        return evt;
    }

    public ObjectNode userJoined(String username) {
        var evt = objectMapper.createObjectNode();
        evt.put("type", "user_joined");
        evt.put("username", username);
        return evt;
    }

    public ObjectNode userLeft(String username) {
        var evt = objectMapper.createObjectNode();
        evt.put("type", "user_left");
        evt.put("username", username);
        return evt;
    }

    public ObjectNode error(String code, String message) {
        var evt = objectMapper.createObjectNode();
        evt.put("type", "error");
        evt.put("code", code);
        evt.put("message", message == null ? messageForCode(code) : message);
        return evt;
    }

    public ObjectNode error(ChatError error) {
        return error(error.code(), null);
    }

    static String messageForCode(String code) {
        if (code == null || code.isBlank()) return "error";
        return switch (code) {
            case "empty_content" -> "Message content cannot be empty";
            case "content_too_long" -> "Message too long (max 2000 characters)";
            case "backend_unavailable" -> "Message could not be saved, try again";
            case "malformed_json" -> "Invalid JSON format";
            case "malformed_frame" -> "Frame must be a JSON object";
            case "missing_type" -> "missing field: type";
            case "unknown_type" -> "Unknown message type";
            case "missing_field" -> "missing required field";
            case "invalid_field" -> "invalid field";
            default -> code;
        };
    }
}
