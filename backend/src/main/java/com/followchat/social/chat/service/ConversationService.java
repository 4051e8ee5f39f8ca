package com.followchat.social.chat.service;

import com.followchat.social.chat.api.ConversationDetailResponse;
import com.followchat.social.chat.api.ConversationSummary;
import com.followchat.social.chat.api.LastMessagePreview;
import com.followchat.social.chat.api.MarkReadResponse;
import com.followchat.social.chat.api.MessageItem;
import com.followchat.social.chat.api.MessagePage;
import com.followchat.social.chat.api.ParticipantItem;
import com.followchat.social.chat.api.SendMessageResponse;
import com.followchat.social.chat.api.StartConversationResponse;
import com.followchat.social.chat.api.UnreadCountResponse;
import com.followchat.social.chat.repo.ConversationRepository;
import com.followchat.social.chat.repo.ConversationRepository.ConversationRow;
import com.followchat.social.chat.repo.ConversationRepository.GetOrCreateResult;
import com.followchat.social.chat.repo.MessageRepository;
import com.followchat.social.chat.ws.OutboundEvents;
import com.followchat.social.chat.ws.WsBroadcaster;
import com.followchat.social.common.api.ChatError;
import com.followchat.social.common.api.ChatException;
import com.followchat.social.social.service.SocialGraphGate;
import com.followchat.social.user.repo.UserAccountRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
public class ConversationService {

    static final int DETAIL_MESSAGE_COUNT = 20;
    static final int PREVIEW_LENGTH = 50;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final MessageService messageService;
    private final UserAccountRepository userAccountRepository;
    private final SocialGraphGate socialGraphGate;
    private final WsBroadcaster wsBroadcaster;
    private final OutboundEvents outboundEvents;

    public ConversationService(
            ConversationRepository conversationRepository,
            MessageRepository messageRepository,
            MessageService messageService,
            UserAccountRepository userAccountRepository,
            SocialGraphGate socialGraphGate,
            WsBroadcaster wsBroadcaster,
            OutboundEvents outboundEvents
    ) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.messageService = messageService;
        this.userAccountRepository = userAccountRepository;
        this.socialGraphGate = socialGraphGate;
        this.wsBroadcaster = wsBroadcaster;
        this.outboundEvents = outboundEvents;
    }

    public GetOrCreateResult getOrCreate(String a, String b) {
        var room = RoomId.of(a, b);
        return conversationRepository.getOrCreate(room.first(), room.second());
    }

    public ConversationRow requireParticipant(String me, String conversationId) {
        return conversationRepository.findById(conversationId)
                .filter(c -> c.hasParticipant(me))
                .orElseThrow(() -> new ChatException(ChatError.CONVERSATION_NOT_FOUND));
    }

    public static RoomId roomOf(ConversationRow conversation) {
        return RoomId.of(conversation.participant1(), conversation.participant2());
    }

    public List<ConversationSummary> listConversations(String me) {
        var rows = conversationRepository.listForUser(me);
        if (rows.isEmpty()) return List.of();

        var unread = messageRepository.countUnreadByConversation(me);
        var out = new ArrayList<ConversationSummary>(rows.size());
        for (var c : rows) {
            var preview = messageService.lastMessage(c)
                    .map(m -> new LastMessagePreview(preview(m.content()), m.sender(), m.createdAt().toString()))
                    .orElse(null);
            out.add(new ConversationSummary(
                    c.id(),
                    participant(c.otherParticipant(me)),
                    preview,
                    unread.getOrDefault(c.id(), 0),
                    roomOf(c).value(),
                    c.createdAt().toString(),
                    c.updatedAt().toString()
            ));
        }
        return out;
    }

    public ConversationDetailResponse detail(String me, String conversationId) {
        var c = requireParticipant(me, conversationId);
        var recent = messageService.listMessages(c, null, DETAIL_MESSAGE_COUNT);
        return new ConversationDetailResponse(
                c.id(),
                participant(c.otherParticipant(me)),
                roomOf(c).value(),
                chronological(recent, me),
                c.createdAt().toString(),
                c.updatedAt().toString()
        );
    }

    public StartResult start(String me, String otherUsername) {
        if (!userAccountRepository.existsUsername(otherUsername)) {
            throw new ChatException(ChatError.USER_NOT_FOUND);
        }
        socialGraphGate.requireCanMessage(me, otherUsername);

        var result = getOrCreate(me, otherUsername);
        var c = result.row();
        var response = new StartConversationResponse(
                c.id(),
                roomOf(c).value(),
                participant(otherUsername),
                result.created()
        );
        return new StartResult(response, result.created());
    }

    public record StartResult(StartConversationResponse response, boolean created) {
    }

    public MessagePage page(String me, String conversationId, String before, int limit) {
        var c = requireParticipant(me, conversationId);
        var cursor = parseCursor(before);
        var safeLimit = Math.max(1, Math.min(limit, 200));

        // One extra row tells whether an older page exists.
        var rows = messageService.listMessages(c, cursor, safeLimit + 1);
        var hasMore = rows.size() > safeLimit;
        if (hasMore) {
            rows = rows.subList(0, safeLimit);
        }
        return new MessagePage(chronological(rows, me), hasMore);
    }

    public MarkReadResponse markRead(String me, String conversationId) {
        var c = requireParticipant(me, conversationId);
        return new MarkReadResponse(messageService.markAllRead(c, me));
    }

    public UnreadCountResponse unreadCount(String me) {
        return new UnreadCountResponse(messageService.totalUnread(me));
    }

    public SendMessageResponse send(String me, String receiver, String content) {
        if (me.equals(receiver)) {
            throw new ChatException(ChatError.SELF_MESSAGE);
        }
        if (!userAccountRepository.existsUsername(receiver)) {
            throw new ChatException(ChatError.USER_NOT_FOUND);
        }
        socialGraphGate.requireCanMessage(me, receiver);
        // Checked before the conversation exists so a rejected send leaves no empty conversation.
        MessageService.contentViolation(content == null ? null : content.strip()).ifPresent(error -> {
            throw new ChatException(error);
        });

        var c = getOrCreate(me, receiver).row();
        var result = messageService.appendMessage(c, me, content);
        if (result instanceof AppendResult.Rejected rejected) {
            throw new ChatException(rejected.error());
        }
        if (result instanceof AppendResult.Unavailable unavailable) {
            throw new ChatException(ChatError.BACKEND_UNAVAILABLE, unavailable.cause());
        }

        var message = ((AppendResult.Appended) result).message();
        var room = roomOf(c);
        wsBroadcaster.broadcast(room, outboundEvents.chatMessage(message), null);
        return new SendMessageResponse(MessageItem.of(message, me), c.id(), room.value());
    }

    private ParticipantItem participant(String username) {
        var bio = userAccountRepository.findPublicByUsername(username)
                .map(UserAccountRepository.UserPublicRow::bio)
                .orElse(null);
        return new ParticipantItem(username, bio);
    }

    private static List<MessageItem> chronological(List<MessageRepository.MessageRow> newestFirst, String viewer) {
        var items = new ArrayList<MessageItem>(newestFirst.size());
        for (var row : newestFirst) {
            items.add(MessageItem.of(row, viewer));
        }
        Collections.reverse(items);
        return items;
    }

    static String preview(String content) {
        if (content.codePointCount(0, content.length()) <= PREVIEW_LENGTH) {
            return content;
        }
        return content.substring(0, content.offsetByCodePoints(0, PREVIEW_LENGTH)) + "...";
    }

    private static Instant parseCursor(String before) {
        if (before == null || before.isBlank()) return null;
        try {
            return OffsetDateTime.parse(before.trim()).toInstant();
        } catch (DateTimeParseException ex) {
            throw new ChatException(ChatError.INVALID_CURSOR, ex);
        }
    }
}
