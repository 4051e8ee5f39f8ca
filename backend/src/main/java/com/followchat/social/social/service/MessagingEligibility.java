package com.followchat.social.social.service;

import com.followchat.social.common.api.ChatError;

public record MessagingEligibility(boolean allowed, ChatError reason) {

    public static MessagingEligibility allow() {
        return new MessagingEligibility(true, null);
    }

    public static MessagingEligibility deny(ChatError reason) {
        return new MessagingEligibility(false, reason);
    }
}
