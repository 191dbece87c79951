package com.example.feedreader.shared.broker;

import java.util.Optional;

/**
 * Broker key and channel naming for the notification pipeline.
 * <ul>
 *   <li>{@code notifications:user:{userId}}: delivery channel</li>
 *   <li>{@code notifications:pending:{topic}:user:{userId}}: pending aggregate (hash)</li>
 *   <li>{@code notifications:timer:{topic}:user:{userId}}: debounce timer (string with TTL)</li>
 *   <li>{@code job:{jobId}}: job record (JSON string with TTL)</li>
 * </ul>
 */
public final class BrokerKeys {

    public static final String CHANNEL_PREFIX = "notifications:user:";
    public static final String PENDING_PREFIX = "notifications:pending:";
    public static final String TIMER_PREFIX = "notifications:timer:";
    public static final String JOB_PREFIX = "job:";

    private static final String USER_SEPARATOR = ":user:";

    private BrokerKeys() {}

    public static String channel(String userId) {
        return CHANNEL_PREFIX + userId;
    }

    public static String pending(String topic, String userId) {
        return PENDING_PREFIX + topic + USER_SEPARATOR + userId;
    }

    public static String timer(String topic, String userId) {
        return TIMER_PREFIX + topic + USER_SEPARATOR + userId;
    }

    public static String job(String jobId) {
        return JOB_PREFIX + jobId;
    }

    public static String expiredEventsChannel(int db) {
        return "__keyevent@" + db + "__:expired";
    }

    /**
     * Maps an expired key back to its debounce identity.
     *
     * @return empty when the key is not a well-formed timer key
     */
    public static Optional<TimerKey> parseTimerKey(String key) {
        if (key == null || !key.startsWith(TIMER_PREFIX)) {
            return Optional.empty();
        }
        String rest = key.substring(TIMER_PREFIX.length());
        int separator = rest.indexOf(USER_SEPARATOR);
        if (separator <= 0) {
            return Optional.empty();
        }
        String topic = rest.substring(0, separator);
        String userId = rest.substring(separator + USER_SEPARATOR.length());
        if (userId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new TimerKey(topic, userId));
    }

    public record TimerKey(String topic, String userId) {}
}
