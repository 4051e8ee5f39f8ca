package com.followchat.social.common.api;

public class ChatException extends RuntimeException {

    private final ChatError error;

    public ChatException(ChatError error) {
        super(error.code());
        this.error = error;
    }

    public ChatException(ChatError error, Throwable cause) {
        super(error.code(), cause);
        this.error = error;
    }

    public ChatError error() {
        return error;
    }
}
