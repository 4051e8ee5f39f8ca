package com.followchat.social.chat.service;

import com.followchat.social.chat.repo.ConversationRepository;
import com.followchat.social.chat.repo.ConversationRepository.ConversationRow;
import com.followchat.social.chat.repo.MessageRepository;
import com.followchat.social.chat.repo.MessageRepository.MessageRow;
import com.followchat.social.common.api.ChatError;
import com.followchat.social.common.time.MonotonicClock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    public static final int MAX_CONTENT_LENGTH = 2000;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final TransactionTemplate transactionTemplate;
    private final MonotonicClock clock;

    private final Counter persisted;
    private final Counter writeFailures;

    public MessageService(
            ConversationRepository conversationRepository,
            MessageRepository messageRepository,
            TransactionTemplate transactionTemplate,
            MonotonicClock clock,
            MeterRegistry meterRegistry
    ) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;

        // Low-cardinality: no per-user or per-conversation tags.
        this.persisted = Counter.builder("followchat.messages.persisted")
                .description("Chat messages committed to the store")
                .register(meterRegistry);
        this.writeFailures = Counter.builder("followchat.messages.write_failures")
                .description("Message write-throughs that failed against the store")
                .register(meterRegistry);
    }

    public static Optional<ChatError> contentViolation(String trimmed) {
        if (trimmed == null || trimmed.isEmpty()) {
            return Optional.of(ChatError.EMPTY_CONTENT);
        }
        if (trimmed.codePointCount(0, trimmed.length()) > MAX_CONTENT_LENGTH) {
            return Optional.of(ChatError.CONTENT_TOO_LONG);
        }
        return Optional.empty();
    }

    public AppendResult appendMessage(ConversationRow conversation, String sender, String rawContent) {
        var content = rawContent == null ? "" : rawContent.strip();
        var violation = contentViolation(content);
        if (violation.isPresent()) {
            return new AppendResult.Rejected(violation.get());
        }

        try {
            var row = transactionTemplate.execute(status -> {
                var createdAt = clock.now();
                var inserted = messageRepository.insertMessage(conversation.id(), sender, content, createdAt);
                conversationRepository.touchUpdatedAt(conversation.id(), createdAt);
                return inserted;
            });
            persisted.increment();
            return new AppendResult.Appended(row);
        } catch (DataAccessException | TransactionException ex) {
            writeFailures.increment();
            log.warn("message_append_failed conversationId={} sender={}", conversation.id(), sender, ex);
            return new AppendResult.Unavailable(ex);
        }
    }

    public int markAllRead(ConversationRow conversation, String reader) {
        return messageRepository.markAllRead(conversation.id(), reader, clock.now());
    }

    public List<MessageRow> listMessages(ConversationRow conversation, Instant before, int limit) {
        return messageRepository.listNewestFirst(conversation.id(), before, limit);
    }

    public Optional<MessageRow> lastMessage(ConversationRow conversation) {
        return messageRepository.findLatest(conversation.id());
    }

    public int unreadCount(ConversationRow conversation, String reader) {
        return messageRepository.countUnread(conversation.id(), reader);
    }

    public int totalUnread(String reader) {
        return messageRepository.countUnreadTotal(reader);
    }
}
