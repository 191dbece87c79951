package com.example.feedreader.notification.service;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immediate notifications that bypass debouncing, such as import completion
 * or discovery results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    public static final String OPML_IMPORT_COMPLETED = "opml_import_completed";
    public static final String OPML_EXPORT_COMPLETED = "opml_export_completed";
    public static final String FEED_DISCOVERY_COMPLETED = "feed_discovery_completed";
    public static final String FEED_RESUME_FAILED = "feed_resume_failed";

    private final NotificationBroker broker;
    private final ObjectMapper objectMapper;
    private final NotificationMetrics notificationMetrics;

    /**
     * Publishes {@code {"type": type, "data": data}} on the user's channel.
     *
     * @return {@code true} if the broker accepted the message
     */
    public Mono<Boolean> publishNow(String userId, String type, Map<String, Object> data) {
        if (userId == null || userId.isBlank() || type == null || type.isBlank()) {
            throw new IllegalArgumentException("userId and type are required");
        }
        String channel = BrokerKeys.channel(userId);
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("data", data == null ? Map.of() : data);

        return Mono.fromCallable(() -> serialize(message))
                .flatMap(json -> broker.publish(channel, json))
                .map(receivers -> {
                    notificationMetrics.incrementCounter(MonitoringConfig.PUBLISHED, "type", type);
                    log.info("Notification {} published on {} ({} receivers)", type, channel, receivers);
                    return true;
                })
                .onErrorResume(e -> {
                    log.error("Failed to publish {} notification for user {}: {}", type, userId, e.getMessage());
                    notificationMetrics.incrementCounter(MonitoringConfig.DROPPED, "stage", "publish");
                    return Mono.just(false);
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
