package com.example.feedreader.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.example.feedreader.shared.broker.BrokerKeys;
import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.config.MonitoringConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class NotificationServiceTest extends NotificationPipelineBaseTest {

    private NotificationService notificationService;

    @BeforeEach
    void setUpService() {
        notificationService = new NotificationService(broker, objectMapper, metrics);
    }

    @Test
    void publishNow_deliversImmediatelyToOpenSession() {
        StepVerifier.create(sessionRegistry.open(USER_ID))
                .expectNextMatches(event -> "connected".equals(event.event()))
                .then(() -> notificationService.publishNow(USER_ID, NotificationService.OPML_IMPORT_COMPLETED,
                        Map.of("job_id", "job-1")).block())
                .expectNextMatches(event -> "message".equals(event.event())
                        && event.data().equals("{\"type\":\"opml_import_completed\",\"data\":{\"job_id\":\"job-1\"}}"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertThat(metrics.getCounterValue(MonitoringConfig.PUBLISHED, "type", "opml_import_completed")).isEqualTo(1);
    }

    @Test
    void publishNow_withoutData_sendsEmptyObject() {
        StepVerifier.create(notificationService.publishNow(USER_ID, NotificationService.FEED_RESUME_FAILED, null))
                .expectNext(true)
                .verifyComplete();

        assertThat(broker.published()).containsExactly("{\"type\":\"feed_resume_failed\",\"data\":{}}");
    }

    @Test
    void publishNow_brokerFailure_returnsFalse() {
        // given
        var failingBroker = mock(NotificationBroker.class);
        given(failingBroker.publish(any(), any())).willReturn(Mono.error(new IllegalStateException("down")));
        var service = new NotificationService(failingBroker, objectMapper, metrics);

        // when / then
        StepVerifier.create(service.publishNow(USER_ID, NotificationService.OPML_EXPORT_COMPLETED, Map.of()))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void publishNow_usesUserChannel() {
        // given
        var received = new CopyOnWriteArrayList<String>();
        var subscription = broker.subscribe(BrokerKeys.channel("u7")).block().subscribe(received::add);

        // when
        notificationService.publishNow("u7", NotificationService.FEED_DISCOVERY_COMPLETED, Map.of()).block();
        notificationService.publishNow(USER_ID, NotificationService.FEED_DISCOVERY_COMPLETED, Map.of()).block();

        // then
        assertThat(received).hasSize(1);
        assertThat(received.get(0)).contains("feed_discovery_completed");
        subscription.dispose();
    }

    @Test
    void publishNow_blankType_isRejected() {
        assertThatThrownBy(() -> notificationService.publishNow(USER_ID, " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
