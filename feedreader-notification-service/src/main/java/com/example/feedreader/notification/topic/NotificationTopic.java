package com.example.feedreader.notification.topic;

import java.util.Arrays;
import java.util.Optional;

/**
 * Debounced notification topics. The wire name is used in broker keys and as
 * the {@code type} of delivered messages.
 */
public enum NotificationTopic {
    NEW_ARTICLES("new_articles"),
    OPML_IMPORT_PROGRESS("opml_import_progress");

    private final String wireName;

    NotificationTopic(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<NotificationTopic> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(topic -> topic.wireName.equals(wireName))
                .findFirst();
    }
}
