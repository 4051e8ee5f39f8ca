package com.followchat.social.chat.api;

import java.util.List;

public record MessagePage(
        List<MessageItem> messages,
        boolean has_more
) {
}
