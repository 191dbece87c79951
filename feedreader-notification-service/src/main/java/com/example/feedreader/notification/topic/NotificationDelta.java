package com.example.feedreader.notification.topic;

/**
 * One event's contribution to a pending aggregate.
 */
public interface NotificationDelta {
}
