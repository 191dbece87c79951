package com.example.feedreader.notification.controller;

import com.example.feedreader.notification.service.SseEventFactory;
import com.example.feedreader.notification.service.StreamSessionRegistry;
import com.example.feedreader.notification.service.TimerExpiryListener;
import com.example.feedreader.shared.config.AppProperties;
import com.example.feedreader.shared.dto.SessionStats;
import com.example.feedreader.shared.util.Constants;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/sse")
@RequiredArgsConstructor
@Slf4j
public class NotificationStreamController {

    private final StreamSessionRegistry streamSessionRegistry;
    private final TimerExpiryListener timerExpiryListener;
    private final SseEventFactory sseEventFactory;
    private final AppProperties appProperties;

    @GetMapping(value = "/notifications", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "sseConnectLimiter", fallbackMethod = "connectFallback")
    public Flux<ServerSentEvent<String>> notifications(ServerWebExchange exchange) {
        String userId = exchange.getAttribute(Constants.SESSION_USER_ATTRIBUTE);
        if (userId == null) {
            log.debug("Unauthenticated notification stream request from {}", exchange.getRequest().getRemoteAddress());
            return Flux.just(sseEventFactory.createErrorEvent(SseEventFactory.AUTHENTICATION_REQUIRED));
        }
        log.info("Notification stream requested by user {}", userId);
        return streamSessionRegistry.open(userId);
    }

    public Flux<ServerSentEvent<String>> connectFallback(ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded. IP: {}. Details: {}", exchange.getRequest().getRemoteAddress(), ex.getMessage());
        return Flux.error(ex);
    }

    @GetMapping("/notifications/stats")
    public ResponseEntity<SessionStats> stats() {
        return ResponseEntity.ok(SessionStats.builder()
                .podId(appProperties.getPod().getId())
                .activeSessions(streamSessionRegistry.getActiveSessionCount())
                .distinctUsers(streamSessionRegistry.getDistinctUserCount())
                .relayedMessages(streamSessionRegistry.getRelayedMessageCount())
                .listenerRunning(timerExpiryListener.isRunning())
                .listenerRestarts(timerExpiryListener.getRestartCount())
                .build());
    }
}
