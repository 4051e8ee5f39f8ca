package com.followchat.social.chat.service;

import com.followchat.social.chat.repo.MessageRepository.MessageRow;
import com.followchat.social.common.api.ChatError;

/**
 * Outcome of a message write-through. Callers branch on the variant instead of catching.
 */
public sealed interface AppendResult permits AppendResult.Appended, AppendResult.Rejected, AppendResult.Unavailable {

    record Appended(MessageRow message) implements AppendResult {
    }

    record Rejected(ChatError error) implements AppendResult {
    }

    record Unavailable(Exception cause) implements AppendResult {
    }
}
