package com.example.feedreader.notification.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class UserFeedRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Users with an active subscription to the feed.
     */
    public List<String> findSubscribedUserIds(String feedId) {
        String sql = "SELECT user_id FROM user_feeds WHERE feed_id = ? AND is_active = TRUE";
        return jdbcTemplate.queryForList(sql, String.class, feedId);
    }
}
