package com.example.feedreader.shared.broker;

import com.example.feedreader.shared.exception.NotificationFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.ReactiveSubscription.Message;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.ReactiveRedisMessageListenerContainer;
import org.springframework.data.redis.serializer.RedisSerializationContext.SerializationPair;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisNotificationBroker implements NotificationBroker {

    /*
     * KEYS[1] = hash to drain, KEYS[2] = companion key deleted in the same step.
     * Returns the HGETALL reply as a JSON array, or '' when the hash was absent.
     */
    static final RedisScript<String> TAKE_HASH_SCRIPT = RedisScript.of("""
            local entries = redis.call('HGETALL', KEYS[1])
            redis.call('DEL', KEYS[1], KEYS[2])
            if #entries == 0 then
                return ''
            end
            return cjson.encode(entries)
            """, String.class);

    private static final SerializationPair<String> STRING_PAIR = SerializationPair.fromSerializer(RedisSerializer.string());
    private static final TypeReference<List<String>> FLAT_ENTRIES = new TypeReference<>() {};

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ReactiveRedisConnectionFactory connectionFactory;
    private final ReactiveRedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Long> incrementField(String key, String field, long delta) {
        return redisTemplate.<String, String>opsForHash().increment(key, field, delta);
    }

    @Override
    public Mono<Boolean> putField(String key, String field, String value) {
        return redisTemplate.<String, String>opsForHash().put(key, field, value);
    }

    @Override
    public Mono<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
    }

    @Override
    public Mono<Map<String, String>> takeHash(String hashKey, String companionKey) {
        return redisTemplate.execute(TAKE_HASH_SCRIPT, List.of(hashKey, companionKey))
                .next()
                .map(this::toEntries)
                .defaultIfEmpty(Map.of());
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public Mono<Long> publish(String channel, String message) {
        return redisTemplate.convertAndSend(channel, message);
    }

    @Override
    public Mono<Flux<String>> subscribe(String channel) {
        return listenerContainer.receiveLater(List.of(ChannelTopic.of(channel)), STRING_PAIR, STRING_PAIR)
                .map(messages -> messages.map(Message::getMessage));
    }

    @Override
    public Flux<String> expiredKeys(String pattern) {
        // A dedicated container per subscription, so a broken connection is never reused on retry.
        return Flux.defer(() -> {
            ReactiveRedisMessageListenerContainer container = new ReactiveRedisMessageListenerContainer(connectionFactory);
            return container.receive(List.of(PatternTopic.of(pattern)), STRING_PAIR, STRING_PAIR)
                    .map(Message::getMessage)
                    .doFinally(signal -> container.destroyLater().subscribe(
                            unused -> { },
                            e -> log.debug("Error releasing expiry listener container: {}", e.getMessage())));
        });
    }

    @Override
    public Mono<Void> enableExpiryEvents() {
        return Mono.usingWhen(
                Mono.fromSupplier(connectionFactory::getReactiveConnection),
                connection -> connection.serverCommands().setConfig("notify-keyspace-events", "Ex"),
                ReactiveRedisConnection::closeLater)
            .then();
    }

    private Map<String, String> toEntries(String encoded) {
        if (encoded.isEmpty()) {
            return Map.of();
        }
        try {
            List<String> flat = objectMapper.readValue(encoded, FLAT_ENTRIES);
            Map<String, String> entries = new LinkedHashMap<>();
            for (int i = 0; i + 1 < flat.size(); i += 2) {
                entries.put(flat.get(i), flat.get(i + 1));
            }
            return entries;
        } catch (JsonProcessingException e) {
            throw new NotificationFormatException("Unreadable pending aggregate reply", e);
        }
    }
}
