package com.followchat.social.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class MessageRepository {

    public record MessageRow(
            String id,
            String conversationId,
            String sender,
            String content,
            Instant createdAt,
            boolean read,
            Instant readAt
    ) {
    }

    private static final RowMapper<MessageRow> ROW_MAPPER = (rs, rowNum) -> {
        var readAt = rs.getTimestamp("read_at");
        return new MessageRow(
                rs.getString("id"),
                rs.getString("conversation_id"),
                rs.getString("sender"),
                rs.getString("content"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getBoolean("is_read"),
                readAt == null ? null : readAt.toInstant()
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public MessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public MessageRow insertMessage(String conversationId, String sender, String content, Instant createdAt) {
        var id = "m_" + UUID.randomUUID();
        var sql = """
                insert into message(id, conversation_id, sender, content, created_at, is_read, read_at)
                values (?, ?, ?, ?, ?, false, null)
                """;
        jdbcTemplate.update(sql, id, conversationId, sender, content, Timestamp.from(createdAt));
        return new MessageRow(id, conversationId, sender, content, createdAt, false, null);
    }

    public List<MessageRow> listNewestFirst(String conversationId, Instant before, int limit) {
        if (before == null) {
            var sql = """
                    select id, conversation_id, sender, content, created_at, is_read, read_at
                    from message
                    where conversation_id = ?
                    order by created_at desc, id desc
                    limit ?
                    """;
            return jdbcTemplate.query(sql, ROW_MAPPER, conversationId, limit);
        }

        var sql = """
                select id, conversation_id, sender, content, created_at, is_read, read_at
                from message
                where conversation_id = ? and created_at < ?
                order by created_at desc, id desc
                limit ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, conversationId, Timestamp.from(before), limit);
    }

    public Optional<MessageRow> findLatest(String conversationId) {
        return listNewestFirst(conversationId, null, 1).stream().findFirst();
    }

    public int markAllRead(String conversationId, String reader, Instant readAt) {
        var sql = """
                update message
                set is_read = true, read_at = ?
                where conversation_id = ? and sender <> ? and is_read = false
                """;
        return jdbcTemplate.update(sql, Timestamp.from(readAt), conversationId, reader);
    }

    public int countUnread(String conversationId, String reader) {
        var sql = "select count(1) from message where conversation_id = ? and sender <> ? and is_read = false";
        Integer n = jdbcTemplate.queryForObject(sql, Integer.class, conversationId, reader);
        return n == null ? 0 : n;
    }

    public Map<String, Integer> countUnreadByConversation(String reader) {
        var sql = """
                select m.conversation_id, count(1) as unread
                from message m
                join conversation c on c.id = m.conversation_id
                where (c.participant_1 = ? or c.participant_2 = ?)
                  and m.sender <> ?
                  and m.is_read = false
                group by m.conversation_id
                """;
        var out = new HashMap<String, Integer>();
        RowCallbackHandler collect = rs -> out.put(rs.getString("conversation_id"), rs.getInt("unread"));
        jdbcTemplate.query(sql, collect, reader, reader, reader);
        return out;
    }

    public int countUnreadTotal(String reader) {
        var sql = """
                select count(1)
                from message m
                join conversation c on c.id = m.conversation_id
                where (c.participant_1 = ? or c.participant_2 = ?)
                  and m.sender <> ?
                  and m.is_read = false
                """;
        Integer n = jdbcTemplate.queryForObject(sql, Integer.class, reader, reader, reader);
        return n == null ? 0 : n;
    }
}
