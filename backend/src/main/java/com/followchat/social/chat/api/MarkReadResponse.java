package com.followchat.social.chat.api;

public record MarkReadResponse(int marked_read) {
}
