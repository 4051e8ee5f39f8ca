package com.followchat.social.chat.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class ConversationRepository {

    public record ConversationRow(
            String id,
            String participant1,
            String participant2,
            Instant createdAt,
            Instant updatedAt
    ) {
        public boolean hasParticipant(String username) {
            return participant1.equals(username) || participant2.equals(username);
        }

        public String otherParticipant(String username) {
            return participant1.equals(username) ? participant2 : participant1;
        }
    }

    public record GetOrCreateResult(ConversationRow row, boolean created) {
    }

    private static final RowMapper<ConversationRow> ROW_MAPPER = (rs, rowNum) -> new ConversationRow(
            rs.getString("id"),
            rs.getString("participant_1"),
            rs.getString("participant_2"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public ConversationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ConversationRow> findById(String id) {
        var sql = """
                select id, participant_1, participant_2, created_at, updated_at
                from conversation
                where id = ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, id).stream().findFirst();
    }

    public Optional<ConversationRow> findByPair(String participant1, String participant2) {
        var sql = """
                select id, participant_1, participant_2, created_at, updated_at
                from conversation
                where participant_1 = ? and participant_2 = ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, participant1, participant2).stream().findFirst();
    }

    /**
     * Upsert keyed by the canonical pair. Callers must pass {@code participant1 < participant2}.
     * The unique constraint decides races: a losing insert re-reads the winner's row.
     */
    public GetOrCreateResult getOrCreate(String participant1, String participant2) {
        var existing = findByPair(participant1, participant2);
        if (existing.isPresent()) {
            return new GetOrCreateResult(existing.get(), false);
        }

        var id = "c_" + UUID.randomUUID();
        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var sql = """
                insert into conversation(id, participant_1, participant_2, created_at, updated_at)
                values (?, ?, ?, ?, ?)
                """;
        try {
            jdbcTemplate.update(sql, id, participant1, participant2, Timestamp.from(now), Timestamp.from(now));
        } catch (DuplicateKeyException dup) {
            var winner = findByPair(participant1, participant2).orElseThrow(() -> dup);
            return new GetOrCreateResult(winner, false);
        }
        return new GetOrCreateResult(new ConversationRow(id, participant1, participant2, now, now), true);
    }

    public List<ConversationRow> listForUser(String username) {
        var sql = """
                select id, participant_1, participant_2, created_at, updated_at
                from conversation
                where participant_1 = ? or participant_2 = ?
                order by updated_at desc, id asc
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, username, username);
    }

    /**
     * Moves {@code updated_at} forward only; a late writer with an older timestamp is a no-op.
     */
    public int touchUpdatedAt(String conversationId, Instant at) {
        var sql = "update conversation set updated_at = ? where id = ? and updated_at < ?";
        var ts = Timestamp.from(at);
        return jdbcTemplate.update(sql, ts, conversationId, ts);
    }
}
