package com.example.feedreader.shared.broker;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Narrow view of the shared key-value and pub/sub store used to coordinate
 * notification delivery across backend instances.
 * <p>
 * Every state change goes through a broker-side atomic primitive; callers must
 * not rely on process-local locking for correctness.
 */
public interface NotificationBroker {

    /**
     * Atomically adds {@code delta} to a hash field, creating the hash when absent.
     */
    Mono<Long> incrementField(String key, String field, long delta);

    /**
     * Sets a hash field, replacing any previous value.
     */
    Mono<Boolean> putField(String key, String field, String value);

    /**
     * Sets {@code key} with the given TTL only if it does not exist yet.
     *
     * @return {@code true} if this call created the key
     */
    Mono<Boolean> setIfAbsent(String key, String value, Duration ttl);

    /**
     * Atomically reads every field of {@code hashKey} and deletes it together
     * with {@code companionKey}. Writes that happen after this call land in a
     * fresh hash.
     *
     * @return the fields read, or an empty map when the hash did not exist
     */
    Mono<Map<String, String>> takeHash(String hashKey, String companionKey);

    Mono<String> get(String key);

    Mono<Boolean> set(String key, String value, Duration ttl);

    /**
     * Publishes a message on a channel without acknowledgement.
     *
     * @return number of subscribers that received the message
     */
    Mono<Long> publish(String channel, String message);

    /**
     * Subscribes to a channel. The outer {@link Mono} emits once the broker has
     * confirmed the subscription; cancelling the inner {@link Flux} releases it.
     */
    Mono<Flux<String>> subscribe(String channel);

    /**
     * Streams the names of keys whose TTL elapsed, as reported by the broker's
     * expiry notifications for the given pattern channel.
     */
    Flux<String> expiredKeys(String pattern);

    /**
     * Asks the broker to emit expiry notifications.
     */
    Mono<Void> enableExpiryEvents();
}
