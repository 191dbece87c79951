package com.example.feedreader.notification.service;

import com.example.feedreader.shared.broker.BrokerKeys;
import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.util.Constants.SseEventType;
import com.example.feedreader.shared.util.Constants.StreamSessionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One open notification stream. Relays messages from the user's delivery
 * channel, interleaved with heartbeats, until the client goes away, the
 * subscription fails or the session is closed.
 * <p>
 * The broker subscription is confirmed before the {@code connected} event is
 * sent, so a client never misses a message published after it saw that event.
 */
@Slf4j
public class StreamSession {

    @Getter
    private final String sessionId;
    @Getter
    private final String userId;
    private final NotificationBroker broker;
    private final SseEventFactory eventFactory;
    private final ObjectMapper objectMapper;
    private final Duration heartbeatInterval;

    private final AtomicReference<StreamSessionState> state = new AtomicReference<>(StreamSessionState.CONNECTING);
    private final AtomicLong relayedMessages = new AtomicLong();
    private final Sinks.Empty<Void> closeSignal = Sinks.empty();
    private final Sinks.Many<ServerSentEvent<String>> controlEvents = Sinks.many().unicast().onBackpressureBuffer();

    public StreamSession(String sessionId, String userId, NotificationBroker broker, SseEventFactory eventFactory,
                         ObjectMapper objectMapper, Duration heartbeatInterval) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.broker = broker;
        this.eventFactory = eventFactory;
        this.objectMapper = objectMapper;
        this.heartbeatInterval = heartbeatInterval;
    }

    public StreamSessionState getState() {
        return state.get();
    }

    public long getRelayedMessages() {
        return relayedMessages.get();
    }

    /**
     * The event stream of this session. Subscribe once.
     */
    public Flux<ServerSentEvent<String>> events() {
        String channel = BrokerKeys.channel(userId);
        return broker.subscribe(channel)
                .flatMapMany(messages -> {
                    if (!state.compareAndSet(StreamSessionState.CONNECTING, StreamSessionState.STREAMING)) {
                        return Flux.empty();
                    }
                    log.info("Stream session {} for user {} subscribed to {}", sessionId, userId, channel);
                    Flux<ServerSentEvent<String>> relayed = messages.map(this::toEvent);
                    Flux<ServerSentEvent<String>> heartbeats = Flux.interval(heartbeatInterval)
                            .map(tick -> eventFactory.createHeartbeatEvent());
                    // relay is subscribed before the connected event is produced
                    return Flux.merge(
                            relayed,
                            Mono.fromSupplier(() -> eventFactory.createConnectedEvent(sessionId)),
                            heartbeats,
                            controlEvents.asFlux());
                })
                .onErrorResume(e -> {
                    log.warn("Stream session {} for user {} failed: {}", sessionId, userId, e.getMessage());
                    return Mono.just(eventFactory.createErrorEvent("Notification stream interrupted"));
                })
                .takeUntil(event -> SseEventType.SHUTDOWN.eventName().equals(event.event()))
                .takeUntilOther(closeSignal.asMono())
                .doFinally(signal -> {
                    state.set(StreamSessionState.CLOSED);
                    log.info("Stream session {} for user {} closed ({}), relayed {} messages",
                            sessionId, userId, signal, relayedMessages.get());
                });
    }

    /**
     * Ends the stream immediately, cancelling the broker subscription.
     */
    public void close() {
        closeSignal.tryEmitEmpty();
    }

    /**
     * Sends {@code shutdownEvent} as the last event of the stream, then ends it.
     */
    public void shutdown(ServerSentEvent<String> shutdownEvent) {
        if (state.get() != StreamSessionState.STREAMING || controlEvents.tryEmitNext(shutdownEvent).isFailure()) {
            close();
        }
    }

    private ServerSentEvent<String> toEvent(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable notification for user {}: {}", userId, e.getOriginalMessage());
            return eventFactory.createErrorEvent("Malformed notification");
        }
        if (node == null || !node.isObject() || !node.path("type").isTextual()) {
            log.warn("Dropping malformed notification for user {}: {}", userId, payload);
            return eventFactory.createErrorEvent("Malformed notification");
        }
        long sequence = relayedMessages.incrementAndGet();
        return eventFactory.createRawEvent(SseEventType.MESSAGE, sessionId + "-" + sequence, payload);
    }
}
