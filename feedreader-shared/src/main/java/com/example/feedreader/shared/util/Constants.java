package com.example.feedreader.shared.util;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class Constants {

    private Constants() {}

    public static final String SESSION_USER_ATTRIBUTE = "feedreader.userId";

    public enum SseEventType {
        CONNECTED("connected"),
        MESSAGE("message"),
        HEARTBEAT("heartbeat"),
        ERROR("error"),
        SHUTDOWN("shutdown");

        private final String eventName;

        SseEventType(String eventName) {
            this.eventName = eventName;
        }

        public String eventName() {
            return eventName;
        }
    }

    public enum StreamSessionState {
        CONNECTING,
        STREAMING,
        CLOSED
    }

    public enum JobStatus {
        @JsonProperty("pending") PENDING,
        @JsonProperty("running") RUNNING,
        @JsonProperty("completed") COMPLETED,
        @JsonProperty("failed") FAILED
    }
}
