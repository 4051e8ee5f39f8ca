package com.followchat.social.chat.ws;

import java.util.Map;

public record ConnectionIdentity(String username) {

    public static final String ATTRIBUTE = "followchat.identity";

    public static final ConnectionIdentity ANONYMOUS = new ConnectionIdentity(null);

    public static ConnectionIdentity of(String username) {
        if (username == null || username.isBlank()) return ANONYMOUS;
        return new ConnectionIdentity(username);
    }

    public static ConnectionIdentity from(Map<String, Object> attributes) {
        if (attributes == null) return ANONYMOUS;
        var value = attributes.get(ATTRIBUTE);
        return value instanceof ConnectionIdentity identity ? identity : ANONYMOUS;
    }

    public boolean anonymous() {
        return username == null;
    }
}
