package com.example.feedreader.notification.topic;

import com.example.feedreader.shared.broker.NotificationBroker;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Merge and formatting rules of one debounced topic.
 */
public interface TopicAggregator {

    NotificationTopic topic();

    boolean accepts(NotificationDelta delta);

    /**
     * Folds {@code delta} into the pending hash at {@code pendingKey} with a
     * single atomic broker command.
     */
    Mono<Void> merge(NotificationBroker broker, String pendingKey, NotificationDelta delta);

    /**
     * Builds the delivered message from a drained pending hash.
     *
     * @return empty when the entries carry nothing worth delivering
     */
    Optional<Map<String, Object>> format(Map<String, String> entries);
}
