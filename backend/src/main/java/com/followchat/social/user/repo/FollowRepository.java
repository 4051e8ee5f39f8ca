package com.followchat.social.user.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
public class FollowRepository {

    private final JdbcTemplate jdbcTemplate;

    public FollowRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean follows(String follower, String followee) {
        var sql = "select 1 from user_follow where follower = ? and followee = ? limit 1";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> 1, follower, followee);
        return !list.isEmpty();
    }

    public boolean follow(String follower, String followee) {
        var sql = "insert into user_follow(follower, followee, created_at) values (?, ?, ?)";
        try {
            return jdbcTemplate.update(sql, follower, followee, Timestamp.from(Instant.now())) > 0;
        } catch (DuplicateKeyException dup) {
            return false;
        }
    }

    public boolean unfollow(String follower, String followee) {
        var sql = "delete from user_follow where follower = ? and followee = ?";
        return jdbcTemplate.update(sql, follower, followee) > 0;
    }

    public int countFollowers(String username) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from user_follow where followee = ?", Integer.class, username);
        return n == null ? 0 : n;
    }

    public int countFollowing(String username) {
        Integer n = jdbcTemplate.queryForObject("select count(1) from user_follow where follower = ?", Integer.class, username);
        return n == null ? 0 : n;
    }
}
