package com.example.feedreader.notification.service;

import com.example.feedreader.notification.topic.NotificationTopic;
import com.example.feedreader.notification.topic.TopicAggregator;
import com.example.feedreader.shared.broker.BrokerKeys;
import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.config.MonitoringConfig;
import com.example.feedreader.shared.config.MonitoringConfig.NotificationMetrics;
import com.example.feedreader.shared.exception.NotificationFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Drains a pending aggregate and publishes it as one message on the user's
 * delivery channel.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlushEngine {

    private final DebounceStore debounceStore;
    private final NotificationBroker broker;
    private final ObjectMapper objectMapper;
    private final NotificationMetrics notificationMetrics;

    /**
     * Safe to call at any time, from any instance. Events queued after the
     * drain land in a fresh aggregate with a fresh timer.
     *
     * @return the subscriber count reported by the broker, or empty when
     *         there was nothing to deliver or delivery failed
     */
    public Mono<Long> flush(String userId, NotificationTopic topic) {
        TopicAggregator aggregator = debounceStore.requireAggregator(topic);
        return debounceStore.take(userId, topic)
                .filter(entries -> !entries.isEmpty())
                .flatMap(entries -> Mono.justOrEmpty(aggregator.format(entries)))
                .flatMap(message -> publish(userId, topic, message))
                .onErrorResume(e -> {
                    log.error("Failed to flush {} notifications for user {}: {}", topic.wireName(), userId, e.getMessage());
                    notificationMetrics.incrementCounter(MonitoringConfig.DROPPED, "stage", "flush");
                    return Mono.empty();
                });
    }

    private Mono<Long> publish(String userId, NotificationTopic topic, Map<String, Object> message) {
        String channel = BrokerKeys.channel(userId);
        return Mono.fromCallable(() -> serialize(message))
                .flatMap(json -> broker.publish(channel, json))
                .doOnNext(receivers -> {
                    notificationMetrics.incrementCounter(MonitoringConfig.FLUSHED, "topic", topic.wireName());
                    log.info("Flushed {} notification to channel {} ({} receivers)", topic.wireName(), channel, receivers);
                });
    }

    private String serialize(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new NotificationFormatException("Cannot serialize " + message.get("type") + " notification", e);
        }
    }
}
