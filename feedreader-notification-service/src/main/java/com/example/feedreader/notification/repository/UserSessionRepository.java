package com.example.feedreader.notification.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Read access to login sessions. Sessions are created and revoked elsewhere.
 */
@Repository
@RequiredArgsConstructor
public class UserSessionRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<UserSession> ROW_MAPPER = (rs, rowNum) -> new UserSession(
            rs.getString("session_id"),
            rs.getString("user_id"),
            rs.getString("cookie_hash"),
            rs.getTimestamp("expires_at").toInstant());

    public Optional<UserSession> findActive(String sessionId, Instant now) {
        String sql = "SELECT session_id, user_id, cookie_hash, expires_at FROM user_sessions WHERE session_id = ? AND expires_at > ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, sessionId, Timestamp.from(now)).stream().findFirst();
    }

    public void touch(String sessionId, Instant now) {
        jdbcTemplate.update("UPDATE user_sessions SET last_used = ? WHERE session_id = ?", Timestamp.from(now), sessionId);
    }

    public record UserSession(String sessionId, String userId, String cookieHash, Instant expiresAt) {}
}
