package com.followchat.social.user.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class UserAccountRepository {

    public record UserAccountRow(String username, String passwordHash, String bio, Instant createdAt) {
    }

    public record UserPublicRow(String username, String bio, Instant createdAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public UserAccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UserAccountRow> findByUsername(String username) {
        var sql = "select username, password_hash, bio, created_at from user_account where username = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new UserAccountRow(
                rs.getString("username"),
                rs.getString("password_hash"),
                rs.getString("bio"),
                rs.getTimestamp("created_at").toInstant()
        ), username);
        return list.stream().findFirst();
    }

    public Optional<UserPublicRow> findPublicByUsername(String username) {
        var sql = "select username, bio, created_at from user_account where username = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new UserPublicRow(
                rs.getString("username"),
                rs.getString("bio"),
                rs.getTimestamp("created_at").toInstant()
        ), username);
        return list.stream().findFirst();
    }

    public boolean existsUsername(String username) {
        var sql = "select 1 from user_account where username = ? limit 1";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> 1, username);
        return !list.isEmpty();
    }

    public void createUser(String username, String passwordHash, String bio) {
        var sql = """
                insert into user_account(username, password_hash, bio, created_at)
                values (?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql, username, passwordHash, bio, Timestamp.from(Instant.now()));
    }
}
