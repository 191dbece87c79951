package com.example.feedreader.notification.topic;

import com.example.feedreader.shared.broker.NotificationBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pending hash: feed id to article count. Counts add up, so merging is
 * commutative and order of arrival does not matter.
 */
@Component
@Slf4j
public class NewArticlesAggregator implements TopicAggregator {

    @Override
    public NotificationTopic topic() {
        return NotificationTopic.NEW_ARTICLES;
    }

    @Override
    public boolean accepts(NotificationDelta delta) {
        return delta instanceof NewArticlesDelta;
    }

    @Override
    public Mono<Void> merge(NotificationBroker broker, String pendingKey, NotificationDelta delta) {
        NewArticlesDelta articles = (NewArticlesDelta) delta;
        return broker.incrementField(pendingKey, articles.feedId(), articles.count()).then();
    }

    @Override
    public Optional<Map<String, Object>> format(Map<String, String> entries) {
        Map<String, Long> feedCounts = new TreeMap<>();
        entries.forEach((feedId, value) -> {
            try {
                long count = Long.parseLong(value);
                if (count > 0) {
                    feedCounts.put(feedId, count);
                }
            } catch (NumberFormatException e) {
                log.warn("Skipping non-numeric article count '{}' for feed {}", value, feedId);
            }
        });
        if (feedCounts.isEmpty()) {
            return Optional.empty();
        }

        List<String> feeds = new ArrayList<>(feedCounts.keySet());
        long total = feedCounts.values().stream().mapToLong(Long::longValue).sum();

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", topic().wireName());
        message.put("feeds", feeds);
        message.put("count", total);
        message.put("feed_counts", feedCounts);
        return Optional.of(message);
    }
}
