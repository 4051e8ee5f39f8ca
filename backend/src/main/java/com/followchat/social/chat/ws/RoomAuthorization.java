package com.followchat.social.chat.ws;

import org.springframework.web.socket.CloseStatus;

public enum RoomAuthorization {

    AUTHORIZED(0, null),
    UNAUTHENTICATED(4001, "unauthenticated"),
    NOT_PARTICIPANT(4002, "not_participant"),
    FORBIDDEN(4003, "forbidden");

    private final int closeCode;
    private final String reason;

    RoomAuthorization(int closeCode, String reason) {
        this.closeCode = closeCode;
        this.reason = reason;
    }

    public int closeCode() {
        return closeCode;
    }

    public String reason() {
        return reason;
    }

    public CloseStatus closeStatus() {
        if (this == AUTHORIZED) {
            throw new IllegalStateException("authorized connections are not closed");
        }
        return new CloseStatus(closeCode, reason);
    }
}
