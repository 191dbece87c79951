package com.example.feedreader.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.feedreader.notification.service.NotificationPublisher;
import com.example.feedreader.notification.topic.NewArticlesDelta;
import com.example.feedreader.notification.topic.NotificationTopic;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.test.StepVerifier;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "feedreader.notifications.debounce-window=1s",
        "feedreader.notifications.heartbeat-interval=1h"
})
@AutoConfigureWebTestClient(timeout = "30s")
@Testcontainers(disabledWithoutDocker = true)
class NotificationApplicationTest {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {};

    @Container
    private static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", REDIS::getHost);
        registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
    }

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private NotificationPublisher publisher;

    private static String sha256(String token) throws Exception {
        var digest = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    @Test
    void unauthenticatedStream_endsWithAuthenticationError() {
        var body = webTestClient.get().uri("/api/sse/notifications")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(SSE_TYPE)
                .getResponseBody();

        StepVerifier.create(body)
                .expectNextMatches(event -> "error".equals(event.event()) && event.data().contains("Authentication required"))
                .verifyComplete();
    }

    @Test
    void authenticatedStream_receivesDebouncedNotification() throws Exception {
        // given
        var token = "sess-it.secret";
        jdbcTemplate.update("INSERT INTO user_sessions (session_id, user_id, cookie_hash, expires_at) VALUES (?, ?, ?, ?)",
                "sess-it", "user-it", sha256(token), Timestamp.from(Instant.now().plus(1, ChronoUnit.DAYS)));

        var body = webTestClient.get().uri("/api/sse/notifications")
                .cookie("session_id", token)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(SSE_TYPE)
                .getResponseBody();

        // when / then
        StepVerifier.create(body)
                .expectNextMatches(event -> "connected".equals(event.event()))
                .then(() -> publisher.queueEvent("user-it", NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 2)).block())
                .expectNextMatches(event -> "message".equals(event.event()) && event.data().contains("\"count\":2"))
                .thenCancel()
                .verify(Duration.ofSeconds(20));
    }

    @Test
    void health_includesNotificationPipeline() {
        webTestClient.get().uri("/actuator/health")
                .exchange()
                .expectBody()
                .jsonPath("$.components.notificationPipeline.details.expiryListener").value(status ->
                        assertThat(status).isIn("UP", "DOWN"));
    }
}
