package com.example.feedreader.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private final Pod pod = new Pod();
    private final Notifications notifications = new Notifications();
    private final Jobs jobs = new Jobs();
    private final Auth auth = new Auth();

    @Data
    public static class Pod {
        @NotBlank
        private String id = "feedreader-0";
    }

    @Data
    public static class Notifications {
        /**
         * Window during which repeated events for one user and topic are merged
         * into a single delivery.
         */
        @NotNull
        private Duration debounceWindow = Duration.ofSeconds(60);
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        /**
         * Redis database whose keyspace expiry events are observed. Must match
         * the database of the configured connection.
         */
        @Min(0)
        private int keyspaceDb = 0;
        private boolean configureKeyspaceEvents = true;
        @NotNull
        private Duration listenerMinBackoff = Duration.ofSeconds(1);
        @NotNull
        private Duration listenerMaxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Jobs {
        @NotNull
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class Auth {
        @NotBlank
        private String cookieName = "session_id";
        @NotNull
        private Duration cacheTtl = Duration.ofSeconds(30);
        @Positive
        private int cacheSize = 10000;
    }
}
