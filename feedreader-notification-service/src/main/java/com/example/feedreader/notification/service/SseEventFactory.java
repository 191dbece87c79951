package com.example.feedreader.notification.service;

import com.example.feedreader.shared.exception.NotificationFormatException;
import com.example.feedreader.shared.util.Constants.SseEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SseEventFactory {

    public static final String AUTHENTICATION_REQUIRED = "Authentication required";

    private final ObjectMapper objectMapper;

    /**
     * Builds an event whose data is {@code data} serialized to JSON.
     */
    public ServerSentEvent<String> createEvent(SseEventType eventType, String eventId, Object data) {
        try {
            return createRawEvent(eventType, eventId, objectMapper.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            throw new NotificationFormatException("Cannot serialize payload of " + eventType.eventName() + " event", e);
        }
    }

    /**
     * Builds an event carrying {@code json} verbatim.
     */
    public ServerSentEvent<String> createRawEvent(SseEventType eventType, String eventId, String json) {
        return ServerSentEvent.<String>builder()
                .event(eventType.eventName())
                .id(eventId)
                .data(json)
                .build();
    }

    public ServerSentEvent<String> createConnectedEvent(String sessionId) {
        return createEvent(SseEventType.CONNECTED, sessionId, Map.of(
                "session_id", sessionId,
                "message", "Notification stream established",
                "timestamp", OffsetDateTime.now().toString()));
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        return createEvent(SseEventType.HEARTBEAT, null, Map.of("timestamp", OffsetDateTime.now().toString()));
    }

    public ServerSentEvent<String> createErrorEvent(String message) {
        return createEvent(SseEventType.ERROR, null, Map.of("message", message));
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return createEvent(SseEventType.SHUTDOWN, null, Map.of(
                "message", "Server is shutting down. Please reconnect momentarily."));
    }
}
