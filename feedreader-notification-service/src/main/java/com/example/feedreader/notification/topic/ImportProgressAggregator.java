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
 * Pending hash: import id to {@code "current/total"}. The latest report per
 * import wins, so replaying a report is harmless.
 */
@Component
@Slf4j
public class ImportProgressAggregator implements TopicAggregator {

    @Override
    public NotificationTopic topic() {
        return NotificationTopic.OPML_IMPORT_PROGRESS;
    }

    @Override
    public boolean accepts(NotificationDelta delta) {
        return delta instanceof ImportProgressDelta;
    }

    @Override
    public Mono<Void> merge(NotificationBroker broker, String pendingKey, NotificationDelta delta) {
        ImportProgressDelta progress = (ImportProgressDelta) delta;
        return broker.putField(pendingKey, progress.importId(), progress.current() + "/" + progress.total()).then();
    }

    @Override
    public Optional<Map<String, Object>> format(Map<String, String> entries) {
        List<Map<String, Object>> imports = new ArrayList<>();
        new TreeMap<>(entries).forEach((importId, value) -> {
            int slash = value.indexOf('/');
            try {
                long current = Long.parseLong(value.substring(0, slash));
                long total = Long.parseLong(value.substring(slash + 1));
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("import_id", importId);
                item.put("current", current);
                item.put("total", total);
                item.put("percentage", total == 0 ? 100 : (int) (current * 100 / total));
                imports.add(item);
            } catch (NumberFormatException | StringIndexOutOfBoundsException e) {
                log.warn("Skipping malformed progress '{}' for import {}", value, importId);
            }
        });
        if (imports.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", topic().wireName());
        message.put("imports", imports);
        return Optional.of(message);
    }
}
