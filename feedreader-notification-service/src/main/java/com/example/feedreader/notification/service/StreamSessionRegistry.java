package com.example.feedreader.notification.service;

import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.config.AppProperties;
import com.example.feedreader.shared.config.MonitoringConfig;
import com.example.feedreader.shared.config.MonitoringConfig.NotificationMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stream sessions open on this instance.
 * <p>
 * The shutdown notice goes out on {@link ContextClosedEvent}, before the web
 * server's graceful shutdown starts waiting for in-flight requests. Open
 * streams never finish on their own, so a later hook would find them already
 * cancelled.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StreamSessionRegistry implements ApplicationListener<ContextClosedEvent> {

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();

    private final NotificationBroker broker;
    private final SseEventFactory eventFactory;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final NotificationMetrics notificationMetrics;

    public Flux<ServerSentEvent<String>> open(String userId) {
        return Flux.defer(() -> {
            StreamSession session = new StreamSession(UUID.randomUUID().toString(), userId, broker, eventFactory,
                    objectMapper, appProperties.getNotifications().getHeartbeatInterval());
            sessions.put(session.getSessionId(), session);
            updateGauge();
            log.debug("Opening stream session {} for user {}", session.getSessionId(), userId);
            return session.events()
                    .doFinally(signal -> {
                        sessions.remove(session.getSessionId());
                        updateGauge();
                    });
        });
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public int getDistinctUserCount() {
        return (int) sessions.values().stream().map(StreamSession::getUserId).distinct().count();
    }

    public long getRelayedMessageCount() {
        return sessions.values().stream().mapToLong(StreamSession::getRelayedMessages).sum();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        shutdown();
    }

    public void shutdown() {
        if (sessions.isEmpty()) {
            return;
        }
        log.info("Sending shutdown notice to {} stream sessions...", sessions.size());
        ServerSentEvent<String> shutdownEvent = eventFactory.createShutdownEvent();
        new ArrayList<>(sessions.values()).forEach(session -> session.shutdown(shutdownEvent));
        log.info("Stream session registry shut down.");
    }

    private void updateGauge() {
        notificationMetrics.setGauge(MonitoringConfig.SESSIONS_ACTIVE, sessions.size());
    }
}
