package com.followchat.social.chat.service;

import com.followchat.social.bootstrap.FollowChatApplication;
import com.followchat.social.chat.repo.MessageRepository;
import com.followchat.social.common.api.ChatError;
import com.followchat.social.user.repo.UserAccountRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Timestamp;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = FollowChatApplication.class)
@ActiveProfiles("dev")
class ConversationStoreTest {

    @Autowired
    ConversationService conversationService;

    @Autowired
    MessageService messageService;

    @Autowired
    MessageRepository messageRepository;

    @Autowired
    UserAccountRepository userAccountRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void get_or_create_is_idempotent_across_argument_order() {
        var a = user("ann");
        var b = user("ben");

        var first = conversationService.getOrCreate(a, b);
        var second = conversationService.getOrCreate(b, a);

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.row().id()).isEqualTo(first.row().id());
        assertThat(countConversations(a, b)).isEqualTo(1);
    }

    @Test
    void concurrent_creators_converge_on_one_row() throws Exception {
        var a = user("cat");
        var b = user("dan");
        var pool = Executors.newFixedThreadPool(4);
        try {
            Callable<String> ab = () -> conversationService.getOrCreate(a, b).row().id();
            Callable<String> ba = () -> conversationService.getOrCreate(b, a).row().id();
            var futures = pool.invokeAll(List.of(ab, ba, ab, ba));
            var ids = new HashSet<String>();
            for (var f : futures) {
                ids.add(f.get(10, TimeUnit.SECONDS));
            }
            assertThat(ids).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(countConversations(a, b)).isEqualTo(1);
    }

    @Test
    void content_limit_is_2000_code_points_after_trim() {
        var a = user("eve");
        var b = user("fay");
        var conv = conversationService.getOrCreate(a, b).row();

        var atLimit = messageService.appendMessage(conv, a, "  " + "x".repeat(2000) + "\n");
        var overLimit = messageService.appendMessage(conv, a, "x".repeat(2001));
        var blank = messageService.appendMessage(conv, a, "   \t ");
        var missing = messageService.appendMessage(conv, a, null);

        assertThat(atLimit).isInstanceOf(AppendResult.Appended.class);
        assertThat(((AppendResult.Appended) atLimit).message().content()).hasSize(2000);
        assertThat(overLimit).isEqualTo(new AppendResult.Rejected(ChatError.CONTENT_TOO_LONG));
        assertThat(blank).isEqualTo(new AppendResult.Rejected(ChatError.EMPTY_CONTENT));
        assertThat(missing).isEqualTo(new AppendResult.Rejected(ChatError.EMPTY_CONTENT));
        assertThat(countMessages(conv.id())).isEqualTo(1);
    }

    @Test
    void supplementary_characters_count_once() {
        var a = user("gus");
        var b = user("hal");
        var conv = conversationService.getOrCreate(a, b).row();

        // U+1F600 is two UTF-16 units but one code point.
        var emoji = new String(Character.toChars(0x1F600));
        var result = messageService.appendMessage(conv, a, emoji.repeat(2000));

        assertThat(result).isInstanceOf(AppendResult.Appended.class);
    }

    @Test
    void append_bumps_updated_at_and_timestamps_increase() {
        var a = user("ida");
        var b = user("jon");
        var conv = conversationService.getOrCreate(a, b).row();

        var m1 = ((AppendResult.Appended) messageService.appendMessage(conv, a, "one")).message();
        var m2 = ((AppendResult.Appended) messageService.appendMessage(conv, b, "two")).message();

        assertThat(m2.createdAt()).isAfter(m1.createdAt());
        var updatedAt = jdbcTemplate.queryForObject(
                "select updated_at from conversation where id = ?", Timestamp.class, conv.id());
        assertThat(updatedAt.toInstant()).isEqualTo(m2.createdAt());
    }

    @Test
    void mark_all_read_flips_only_the_other_side_and_is_idempotent() {
        var a = user("kim");
        var b = user("lou");
        var conv = conversationService.getOrCreate(a, b).row();
        messageService.appendMessage(conv, a, "hi");
        messageService.appendMessage(conv, a, "there");
        messageService.appendMessage(conv, b, "yo");

        assertThat(messageService.unreadCount(conv, b)).isEqualTo(2);
        assertThat(messageService.markAllRead(conv, b)).isEqualTo(2);
        assertThat(messageService.markAllRead(conv, b)).isZero();
        assertThat(messageService.unreadCount(conv, b)).isZero();
        assertThat(messageService.unreadCount(conv, a)).isEqualTo(1);

        var read = messageService.listMessages(conv, null, 10).stream()
                .filter(m -> m.sender().equals(a))
                .toList();
        assertThat(read).allSatisfy(m -> {
            assertThat(m.read()).isTrue();
            assertThat(m.readAt()).isNotNull();
        });
    }

    @Test
    void list_messages_pages_strictly_before_the_cursor() {
        var a = user("max");
        var b = user("ned");
        var conv = conversationService.getOrCreate(a, b).row();
        for (var i = 0; i < 5; i++) {
            messageService.appendMessage(conv, i % 2 == 0 ? a : b, "m" + i);
        }

        var newest = messageService.listMessages(conv, null, 2);
        assertThat(newest).extracting(MessageRepository.MessageRow::content).containsExactly("m4", "m3");

        var older = messageService.listMessages(conv, newest.get(1).createdAt(), 10);
        assertThat(older).extracting(MessageRepository.MessageRow::content).containsExactly("m2", "m1", "m0");
    }

    @Test
    void preview_cuts_at_fifty_characters() {
        assertThat(ConversationService.preview("short")).isEqualTo("short");
        assertThat(ConversationService.preview("y".repeat(50))).isEqualTo("y".repeat(50));
        assertThat(ConversationService.preview("y".repeat(51))).isEqualTo("y".repeat(50) + "...");
    }

    private String user(String prefix) {
        var username = prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        userAccountRepository.createUser(username, "x", null);
        return username;
    }

    private int countConversations(String a, String b) {
        Integer n = jdbcTemplate.queryForObject(
                "select count(1) from conversation where (participant_1 = ? and participant_2 = ?) or (participant_1 = ? and participant_2 = ?)",
                Integer.class, a, b, b, a);
        return n == null ? 0 : n;
    }

    private int countMessages(String conversationId) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from message where conversation_id = ?", Integer.class, conversationId);
        return n == null ? 0 : n;
    }
}
