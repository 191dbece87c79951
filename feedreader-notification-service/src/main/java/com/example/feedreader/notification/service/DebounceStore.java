package com.example.feedreader.notification.service;

import com.example.feedreader.notification.topic.NotificationDelta;
import com.example.feedreader.notification.topic.NotificationTopic;
import com.example.feedreader.notification.topic.TopicAggregator;
import com.example.feedreader.shared.broker.BrokerKeys;
import com.example.feedreader.shared.broker.NotificationBroker;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending aggregates and debounce timers per user and topic, both held in the
 * broker so every instance sees the same state.
 */
@Component
public class DebounceStore {

    private static final String TIMER_VALUE = "1";

    private final NotificationBroker broker;
    private final Map<NotificationTopic, TopicAggregator> aggregators = new EnumMap<>(NotificationTopic.class);

    public DebounceStore(NotificationBroker broker, List<TopicAggregator> aggregators) {
        this.broker = broker;
        aggregators.forEach(aggregator -> this.aggregators.put(aggregator.topic(), aggregator));
    }

    public Optional<TopicAggregator> aggregator(NotificationTopic topic) {
        return Optional.ofNullable(aggregators.get(topic));
    }

    public Mono<Void> merge(String userId, NotificationTopic topic, NotificationDelta delta) {
        TopicAggregator aggregator = requireAggregator(topic);
        return aggregator.merge(broker, BrokerKeys.pending(topic.wireName(), userId), delta);
    }

    /**
     * Starts a debounce cycle unless one is already running.
     *
     * @return {@code true} if this call armed the timer
     */
    public Mono<Boolean> armTimer(String userId, NotificationTopic topic, Duration window) {
        return broker.setIfAbsent(BrokerKeys.timer(topic.wireName(), userId), TIMER_VALUE, window)
                .defaultIfEmpty(false);
    }

    /**
     * Atomically drains the pending aggregate and clears its timer.
     */
    public Mono<Map<String, String>> take(String userId, NotificationTopic topic) {
        return broker.takeHash(BrokerKeys.pending(topic.wireName(), userId), BrokerKeys.timer(topic.wireName(), userId));
    }

    TopicAggregator requireAggregator(NotificationTopic topic) {
        return aggregator(topic)
                .orElseThrow(() -> new IllegalStateException("No aggregator registered for topic " + topic.wireName()));
    }
}
