package com.example.feedreader.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the notification pipeline.
 */
@Configuration
public class MonitoringConfig {

    public static final String QUEUED = "notifications.queued";
    public static final String FLUSHED = "notifications.flushed";
    public static final String PUBLISHED = "notifications.published";
    public static final String DROPPED = "notifications.dropped";
    public static final String LISTENER_RESTARTS = "notifications.listener.restarts";
    public static final String SESSIONS_ACTIVE = "notifications.sessions.active";

    @Bean
    public MeterBinder notificationMeters() {
        return registry -> {
            Counter.builder(LISTENER_RESTARTS)
                    .description("Resubscriptions of the timer expiry listener")
                    .register(registry);
            Counter.builder(DROPPED)
                    .description("Notifications lost to broker or format errors")
                    .tag("stage", "queue")
                    .register(registry);
            Counter.builder(DROPPED)
                    .description("Notifications lost to broker or format errors")
                    .tag("stage", "flush")
                    .register(registry);
        };
    }

    @Bean
    public NotificationMetrics notificationMetrics(MeterRegistry registry) {
        return new NotificationMetrics(registry);
    }

    public static class NotificationMetrics {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public NotificationMetrics(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void setGauge(String name, long value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set(value);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
