package com.followchat.social.common.api;

import org.springframework.http.HttpStatus;

public enum ChatError {

    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),
    INVALID_CREDENTIALS("invalid_credentials", HttpStatus.UNAUTHORIZED),
    FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
    SELF_MESSAGE("self_message", HttpStatus.FORBIDDEN),
    NOT_MUTUAL("not_mutual", HttpStatus.FORBIDDEN),
    SELF_FOLLOW("self_follow", HttpStatus.BAD_REQUEST),
    USER_NOT_FOUND("user_not_found", HttpStatus.NOT_FOUND),
    CONVERSATION_NOT_FOUND("conversation_not_found", HttpStatus.NOT_FOUND),
    USERNAME_TAKEN("username_taken", HttpStatus.CONFLICT),
    INVALID_USERNAME("invalid_username", HttpStatus.BAD_REQUEST),
    EMPTY_CONTENT("empty_content", HttpStatus.BAD_REQUEST),
    CONTENT_TOO_LONG("content_too_long", HttpStatus.BAD_REQUEST),
    INVALID_CURSOR("invalid_cursor", HttpStatus.BAD_REQUEST),
    BACKEND_UNAVAILABLE("backend_unavailable", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final HttpStatus status;

    ChatError(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
