package com.followchat.social.chat.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.followchat.social.bootstrap.FollowChatApplication;
import com.followchat.social.chat.repo.MessageRepository;
import com.followchat.social.chat.service.RoomId;
import com.followchat.social.user.repo.FollowRepository;
import com.followchat.social.user.repo.UserAccountRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = FollowChatApplication.class)
@ActiveProfiles("dev")
class WsHandlerTest {

    @Autowired
    WsHandler handler;

    @Autowired
    WsSessionRegistry sessionRegistry;

    @Autowired
    UserAccountRepository userAccountRepository;

    @Autowired
    FollowRepository followRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    ObjectMapper objectMapper;

    @SpyBean
    MessageRepository messageRepository;

    @Test
    void chat_message_is_persisted_and_echoed_to_both_participants() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(alice, bob).value();

        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);

        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"chat_message\",\"content\":\"  hello bob  \"}"));

        var toAlice = a.ofType("chat_message");
        var toBob = b.ofType("chat_message");
        assertThat(toAlice).hasSize(1);
        assertThat(toBob).hasSize(1);
        assertThat(toBob.get(0).path("content").asText()).isEqualTo("hello bob");
        assertThat(toBob.get(0).path("sender").asText()).isEqualTo(alice);
        assertThat(toBob.get(0).path("message_id").asText()).isEqualTo(toAlice.get(0).path("message_id").asText());
        assertThat(toBob.get(0).path("timestamp").asText()).endsWith("Z");

        assertThat(countMessages(alice, bob)).isEqualTo(1);
        assertThat(a.ofType("user_joined")).extracting(n -> n.path("username").asText()).containsExactly(bob);
        assertThat(b.ofType("user_joined")).isEmpty();
    }

    @Test
    void non_mutual_pair_is_closed_4003_and_never_registered() throws Exception {
        var carol = user("carol");
        var dave = user("dave");
        followRepository.follow(carol, dave);

        var c = new FakeSession(carol, RoomId.of(carol, dave).value());
        handler.afterConnectionEstablished(c.session);

        verify(c.session).close(new CloseStatus(4003, "forbidden"));
        assertThat(sessionRegistry.connection(c.id)).isEmpty();
    }

    @Test
    void outsider_is_closed_4002() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        var eve = user("eve");
        befriend(alice, bob);
        befriend(eve, alice);
        befriend(eve, bob);

        var e = new FakeSession(eve, RoomId.of(alice, bob).value());
        handler.afterConnectionEstablished(e.session);

        verify(e.session).close(new CloseStatus(4002, "not_participant"));
        assertThat(sessionRegistry.connection(e.id)).isEmpty();
    }

    @Test
    void anonymous_is_closed_4001() throws Exception {
        var anon = new FakeSession(null, "alice_bob");
        handler.afterConnectionEstablished(anon.session);

        verify(anon.session).close(new CloseStatus(4001, "unauthenticated"));
        assertThat(sessionRegistry.connection(anon.id)).isEmpty();
    }

    @Test
    void oversized_message_errors_to_sender_only_and_persists_nothing() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(bob, alice).value();
        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);
        var bobBefore = b.received.size();

        var content = "x".repeat(2500);
        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"chat_message\",\"content\":\"" + content + "\"}"));

        var errors = a.ofType("error");
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).path("code").asText()).isEqualTo("content_too_long");
        assertThat(b.received).hasSize(bobBefore);
        assertThat(countMessages(alice, bob)).isZero();
        verify(a.session, never()).close(any());
    }

    @Test
    void storage_failure_errors_to_sender_only_and_broadcasts_nothing() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(alice, bob).value();
        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);
        var bobBefore = b.received.size();

        doThrow(new DataAccessResourceFailureException("database down"))
                .when(messageRepository).insertMessage(any(), any(), any(), any());

        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"chat_message\",\"content\":\"lost\"}"));

        var errors = a.ofType("error");
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).path("code").asText()).isEqualTo("backend_unavailable");
        assertThat(a.ofType("chat_message")).isEmpty();
        assertThat(b.received).hasSize(bobBefore);
        assertThat(countMessages(alice, bob)).isZero();
        verify(a.session, never()).close(any());
    }

    @Test
    void unfollow_does_not_close_an_open_connection() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(alice, bob).value();
        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);

        followRepository.unfollow(bob, alice);
        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"chat_message\",\"content\":\"after unfollow\"}"));

        assertThat(sessionRegistry.connection(a.id)).isPresent();
        verify(a.session, never()).close(any());
        assertThat(b.ofType("chat_message")).extracting(n -> n.path("content").asText())
                .containsExactly("after unfollow");
        assertThat(countMessages(alice, bob)).isEqualTo(1);
    }

    @Test
    void typing_is_not_echoed_to_the_typist() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(alice, bob).value();
        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);

        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"typing_start\"}"));
        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"typing_stop\"}"));

        assertThat(a.ofType("typing")).isEmpty();
        assertThat(b.ofType("typing")).extracting(n -> n.path("is_typing").asBoolean()).containsExactly(true, false);
        assertThat(b.ofType("typing")).allSatisfy(n -> assertThat(n.path("username").asText()).isEqualTo(alice));
    }

    @Test
    void read_receipt_goes_to_the_other_side() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(alice, bob).value();
        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);

        handler.handleTextMessage(b.session, new TextMessage("{\"type\":\"mark_read\",\"message_ids\":[\"m_1\"]}"));

        var receipts = a.ofType("read_receipt");
        assertThat(receipts).hasSize(1);
        assertThat(receipts.get(0).path("reader").asText()).isEqualTo(bob);
        assertThat(receipts.get(0).path("message_ids").get(0).asText()).isEqualTo("m_1");
        assertThat(b.ofType("read_receipt")).isEmpty();
    }

    @Test
    void bad_frames_get_an_error_and_keep_the_connection() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var a = new FakeSession(alice, RoomId.of(alice, bob).value());
        handler.afterConnectionEstablished(a.session);

        handler.handleTextMessage(a.session, new TextMessage("{not json"));
        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"shout\"}"));
        handler.handleTextMessage(a.session, new TextMessage("{\"type\":\"chat_message\",\"content\":\"   \"}"));

        assertThat(a.ofType("error")).extracting(n -> n.path("code").asText())
                .containsExactly("malformed_json", "unknown_type", "empty_content");
        verify(a.session, never()).close(any());
        assertThat(sessionRegistry.connection(a.id)).isPresent();
    }

    @Test
    void disconnect_leaves_the_room_and_announces_it_once() throws Exception {
        var alice = user("alice");
        var bob = user("bob");
        befriend(alice, bob);
        var room = RoomId.of(alice, bob).value();
        var a = new FakeSession(alice, room);
        var b = new FakeSession(bob, room);
        handler.afterConnectionEstablished(a.session);
        handler.afterConnectionEstablished(b.session);

        handler.afterConnectionClosed(b.session, CloseStatus.NORMAL);
        handler.afterConnectionClosed(b.session, CloseStatus.NORMAL);

        assertThat(a.ofType("user_left")).extracting(n -> n.path("username").asText()).containsExactly(bob);
        assertThat(sessionRegistry.connection(b.id)).isEmpty();
        assertThat(sessionRegistry.members(RoomId.of(alice, bob)))
                .extracting(WsSessionRegistry.LiveConnection::username)
                .containsExactly(alice);
    }

    private String user(String prefix) {
        var username = prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        userAccountRepository.createUser(username, "x", null);
        return username;
    }

    private void befriend(String a, String b) {
        followRepository.follow(a, b);
        followRepository.follow(b, a);
    }

    private int countMessages(String a, String b) {
        var room = RoomId.of(a, b);
        Integer n = jdbcTemplate.queryForObject("""
                select count(1)
                from message m
                join conversation c on c.id = m.conversation_id
                where c.participant_1 = ? and c.participant_2 = ?
                """, Integer.class, room.first(), room.second());
        return n == null ? 0 : n;
    }

    private final class FakeSession {
        final String id = "s-" + UUID.randomUUID();
        final WebSocketSession session = mock(WebSocketSession.class);
        final List<String> received = new ArrayList<>();

        FakeSession(String username, String room) throws Exception {
            var attributes = new HashMap<String, Object>();
            attributes.put(ConnectionIdentity.ATTRIBUTE, ConnectionIdentity.of(username));
            when(session.getId()).thenReturn(id);
            when(session.getAttributes()).thenReturn(attributes);
            when(session.getUri()).thenReturn(URI.create("ws://localhost/ws/chat/" + room));
            when(session.isOpen()).thenReturn(true);
            doAnswer(inv -> {
                received.add(((TextMessage) inv.getArgument(0)).getPayload());
                return null;
            }).when(session).sendMessage(any());
        }

        List<JsonNode> ofType(String type) throws Exception {
            var out = new ArrayList<JsonNode>();
            for (var raw : received) {
                var node = objectMapper.readTree(raw);
                if (type.equals(node.path("type").asText())) {
                    out.add(node);
                }
            }
            return out;
        }
    }
}
