package com.followchat.social.chat.ws;

public class FrameRejectedException extends RuntimeException {

    private final String code;

    public FrameRejectedException(String code, String message) {
        super(message);
        this.code = code;
    }

    public FrameRejectedException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
