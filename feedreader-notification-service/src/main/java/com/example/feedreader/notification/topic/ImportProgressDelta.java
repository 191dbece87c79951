package com.example.feedreader.notification.topic;

public record ImportProgressDelta(String importId, long current, long total) implements NotificationDelta {

    public ImportProgressDelta {
        if (importId == null || importId.isBlank()) {
            throw new IllegalArgumentException("importId must not be blank");
        }
        if (current < 0 || total < 0 || current > total) {
            throw new IllegalArgumentException("invalid progress " + current + "/" + total);
        }
    }
}
