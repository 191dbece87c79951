package com.example.feedreader.notification.topic;

/**
 * {@code count} new articles were stored for {@code feedId}.
 */
public record NewArticlesDelta(String feedId, long count) implements NotificationDelta {

    public NewArticlesDelta {
        if (feedId == null || feedId.isBlank()) {
            throw new IllegalArgumentException("feedId must not be blank");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, was " + count);
        }
    }
}
