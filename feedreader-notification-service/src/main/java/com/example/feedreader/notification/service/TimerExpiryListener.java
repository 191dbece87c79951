package com.example.feedreader.notification.service;

import com.example.feedreader.notification.topic.NotificationTopic;
import com.example.feedreader.shared.broker.BrokerKeys;
import com.example.feedreader.shared.broker.BrokerKeys.TimerKey;
import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.config.AppProperties;
import com.example.feedreader.shared.config.MonitoringConfig;
import com.example.feedreader.shared.config.MonitoringConfig.NotificationMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Flushes pending aggregates when their debounce timers expire. Every instance
 * runs one listener; the atomic drain in {@link FlushEngine} makes sure each
 * aggregate is delivered once even though all instances see the expiry.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TimerExpiryListener {

    private final NotificationBroker broker;
    private final FlushEngine flushEngine;
    private final AppProperties appProperties;
    private final NotificationMetrics notificationMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong restarts = new AtomicLong();
    private Disposable subscription;

    @PostConstruct
    public void start() {
        AppProperties.Notifications config = appProperties.getNotifications();
        Mono<Void> prepare = config.isConfigureKeyspaceEvents()
                ? broker.enableExpiryEvents()
                    .doOnSuccess(unused -> log.info("Enabled keyspace expiry notifications"))
                    .onErrorResume(e -> {
                        log.warn("Could not enable keyspace expiry notifications, relying on server config: {}", e.getMessage());
                        return Mono.empty();
                    })
                : Mono.empty();

        subscription = prepare.thenMany(listen())
                .subscribe(
                        unused -> { },
                        e -> log.error("Timer expiry listener terminated unexpectedly", e));
    }

    @PreDestroy
    public void stop() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Timer expiry listener stopped.");
        }
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getRestartCount() {
        return restarts.get();
    }

    Flux<Long> listen() {
        AppProperties.Notifications config = appProperties.getNotifications();
        String pattern = BrokerKeys.expiredEventsChannel(config.getKeyspaceDb());

        return Flux.defer(() -> broker.expiredKeys(pattern))
                .doOnSubscribe(s -> {
                    running.set(true);
                    log.info("Timer expiry listener subscribed to {}", pattern);
                })
                .flatMap(this::onExpired)
                .doOnError(e -> {
                    running.set(false);
                    log.warn("Timer expiry listener lost its subscription: {}", e.getMessage());
                })
                .doOnComplete(() -> {
                    running.set(false);
                    log.warn("Timer expiry subscription on {} completed, resubscribing", pattern);
                })
                .repeatWhen(completions -> completions
                        .doOnNext(n -> recordRestart())
                        .delayElements(config.getListenerMinBackoff()))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, config.getListenerMinBackoff())
                        .maxBackoff(config.getListenerMaxBackoff())
                        .transientErrors(true)
                        .doBeforeRetry(signal -> {
                            recordRestart();
                            log.info("Restarting timer expiry listener (attempt {})", signal.totalRetries() + 1);
                        }));
    }

    Mono<Long> onExpired(String key) {
        Optional<TimerKey> timerKey = BrokerKeys.parseTimerKey(key);
        if (timerKey.isEmpty()) {
            if (key != null && key.startsWith(BrokerKeys.TIMER_PREFIX)) {
                log.warn("Ignoring malformed timer key {}", key);
            }
            return Mono.empty();
        }
        Optional<NotificationTopic> topic = NotificationTopic.fromWireName(timerKey.get().topic());
        if (topic.isEmpty()) {
            log.warn("Ignoring timer key {} with unknown topic", key);
            return Mono.empty();
        }
        String userId = timerKey.get().userId();
        log.debug("Debounce timer expired for user {} topic {}", userId, topic.get().wireName());
        return Mono.defer(() -> flushEngine.flush(userId, topic.get()))
                .onErrorResume(e -> {
                    log.error("Flush after timer expiry failed for key {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private void recordRestart() {
        restarts.incrementAndGet();
        notificationMetrics.incrementCounter(MonitoringConfig.LISTENER_RESTARTS);
    }
}
