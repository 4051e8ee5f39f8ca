package com.followchat.social.chat.service;

import java.util.Optional;

/**
 * Room name for the unordered pair of participants: both identities in {@link String#compareTo}
 * order joined by {@value #SEPARATOR}, so {@code of(a, b).equals(of(b, a))}.
 */
public record RoomId(String first, String second) {

    public static final char SEPARATOR = '_';

    public RoomId {
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("room participants out of order");
        }
    }

    public static RoomId of(String a, String b) {
        requireToken(a);
        requireToken(b);
        return a.compareTo(b) <= 0 ? new RoomId(a, b) : new RoomId(b, a);
    }

    /**
     * Accepts either participant order. Anything that does not split into exactly two non-blank
     * tokens is not a room.
     */
    public static Optional<RoomId> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        var tokens = raw.split(String.valueOf(SEPARATOR), -1);
        if (tokens.length != 2) return Optional.empty();
        if (tokens[0].isBlank() || tokens[1].isBlank()) return Optional.empty();
        return Optional.of(of(tokens[0], tokens[1]));
    }

    public String value() {
        return first + SEPARATOR + second;
    }

    public boolean contains(String username) {
        return first.equals(username) || second.equals(username);
    }

    public String other(String username) {
        return first.equals(username) ? second : first;
    }

    @Override
    public String toString() {
        return value();
    }

    private static void requireToken(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("blank room participant");
        }
        if (identity.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("room participant contains separator: " + identity);
        }
    }
}
