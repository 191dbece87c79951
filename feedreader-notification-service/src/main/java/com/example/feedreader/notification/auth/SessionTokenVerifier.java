package com.example.feedreader.notification.auth;

import com.example.feedreader.notification.repository.UserSessionRepository;
import com.example.feedreader.shared.config.AppProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Resolves a session cookie token of the form {@code {sessionId}.{secret}} to
 * the owning user id. Verified tokens are cached briefly so reconnecting
 * clients do not hit the database on every attempt.
 */
@Component
@Slf4j
public class SessionTokenVerifier {

    private final UserSessionRepository userSessionRepository;
    private final Scheduler jdbcScheduler;
    private final Clock clock;
    private final Cache<String, String> verifiedTokens;

    @Autowired
    public SessionTokenVerifier(UserSessionRepository userSessionRepository,
                                @Qualifier("jdbcScheduler") Scheduler jdbcScheduler,
                                AppProperties appProperties) {
        this(userSessionRepository, jdbcScheduler, appProperties, Clock.systemUTC());
    }

    SessionTokenVerifier(UserSessionRepository userSessionRepository, Scheduler jdbcScheduler,
                         AppProperties appProperties, Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.jdbcScheduler = jdbcScheduler;
        this.clock = clock;
        this.verifiedTokens = Caffeine.newBuilder()
                .expireAfterWrite(appProperties.getAuth().getCacheTtl())
                .maximumSize(appProperties.getAuth().getCacheSize())
                .build();
    }

    /**
     * @return the user id, or empty when the token is malformed, unknown,
     *         expired or does not match the stored hash
     */
    public Mono<String> verify(String token) {
        Optional<String> sessionId = extractSessionId(token);
        if (sessionId.isEmpty()) {
            return Mono.empty();
        }
        String cached = verifiedTokens.getIfPresent(token);
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.fromCallable(() -> lookup(sessionId.get(), token).orElse(null))
                .subscribeOn(jdbcScheduler)
                .doOnNext(userId -> verifiedTokens.put(token, userId))
                .onErrorResume(e -> {
                    log.error("Error verifying session {}: {}", sessionId.get(), e.getMessage());
                    return Mono.empty();
                });
    }

    static Optional<String> extractSessionId(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        int dot = token.indexOf('.');
        String sessionId = dot < 0 ? token : token.substring(0, dot);
        return sessionId.isBlank() ? Optional.empty() : Optional.of(sessionId);
    }

    static String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Optional<String> lookup(String sessionId, String token) {
        Instant now = clock.instant();
        return userSessionRepository.findActive(sessionId, now)
                .filter(session -> session.cookieHash() != null && MessageDigest.isEqual(
                        session.cookieHash().getBytes(StandardCharsets.US_ASCII),
                        hashToken(token).getBytes(StandardCharsets.US_ASCII)))
                .map(session -> {
                    userSessionRepository.touch(sessionId, now);
                    return session.userId();
                });
    }
}
