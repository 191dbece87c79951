package com.example.feedreader.notification.service;

import com.example.feedreader.notification.topic.NotificationDelta;
import com.example.feedreader.notification.topic.NotificationTopic;
import com.example.feedreader.notification.topic.TopicAggregator;
import com.example.feedreader.shared.config.AppProperties;
import com.example.feedreader.shared.config.MonitoringConfig;
import com.example.feedreader.shared.config.MonitoringConfig.NotificationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for debounced notifications. Events for the same user and topic
 * that arrive within one debounce window are delivered as a single message
 * when the window closes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationPublisher {

    private final DebounceStore debounceStore;
    private final AppProperties appProperties;
    private final NotificationMetrics notificationMetrics;

    /**
     * Merges {@code delta} into the user's pending aggregate and arms the
     * debounce timer if none is running. The window is measured from the first
     * event of a burst; later events do not extend it.
     *
     * @throws IllegalArgumentException if the user id is blank or the delta
     *                                  does not belong to the topic
     */
    public Mono<Void> queueEvent(String userId, NotificationTopic topic, NotificationDelta delta) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (topic == null || delta == null) {
            throw new IllegalArgumentException("topic and delta are required");
        }
        TopicAggregator aggregator = debounceStore.requireAggregator(topic);
        if (!aggregator.accepts(delta)) {
            throw new IllegalArgumentException(
                    "Delta " + delta.getClass().getSimpleName() + " does not match topic " + topic.wireName());
        }

        return debounceStore.merge(userId, topic, delta)
                .then(debounceStore.armTimer(userId, topic, appProperties.getNotifications().getDebounceWindow()))
                .doOnNext(armed -> {
                    notificationMetrics.incrementCounter(MonitoringConfig.QUEUED, "topic", topic.wireName());
                    if (armed) {
                        log.debug("Armed {} debounce timer for user {}", topic.wireName(), userId);
                    }
                    log.debug("Queued {} event for user {}: {}", topic.wireName(), userId, delta);
                })
                .onErrorResume(e -> {
                    log.error("Failed to queue {} event for user {}: {}", topic.wireName(), userId, e.getMessage());
                    notificationMetrics.incrementCounter(MonitoringConfig.DROPPED, "stage", "queue");
                    return Mono.empty();
                })
                .then();
    }
}
