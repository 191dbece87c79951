package com.example.feedreader.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

import com.example.feedreader.notification.topic.ImportProgressAggregator;
import com.example.feedreader.notification.topic.ImportProgressDelta;
import com.example.feedreader.notification.topic.NewArticlesAggregator;
import com.example.feedreader.notification.topic.NewArticlesDelta;
import com.example.feedreader.notification.topic.NotificationTopic;
import com.example.feedreader.shared.broker.NotificationBroker;
import com.example.feedreader.shared.config.MonitoringConfig;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class NotificationPublisherTest extends NotificationPipelineBaseTest {

    @Test
    void queueEvent_burstInWindow_deliversOneMergedPayload() throws Exception {
        // given
        startListening();

        // when
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 1)).block();
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 2)).block();
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f2", 1)).block();
        advance(WINDOW.minusSeconds(1));

        // then
        assertThat(broker.published()).isEmpty();
        assertThat(broker.hash(pendingKey("new_articles"))).containsEntry("f1", "3").containsEntry("f2", "1");

        advance(Duration.ofSeconds(1));
        assertThat(broker.published()).hasSize(1);
        var message = json(broker.published().get(0));
        assertThat(message.get("type").asText()).isEqualTo("new_articles");
        assertThat(message.get("feeds")).hasSize(2);
        assertThat(message.get("feeds").get(0).asText()).isEqualTo("f1");
        assertThat(message.get("feeds").get(1).asText()).isEqualTo("f2");
        assertThat(message.get("count").asLong()).isEqualTo(4);
        assertThat(message.get("feed_counts").get("f1").asLong()).isEqualTo(3);
        assertThat(broker.exists(pendingKey("new_articles"))).isFalse();
        assertThat(broker.exists(timerKey("new_articles"))).isFalse();
    }

    @Test
    void queueEvent_laterEventsOfBurst_doNotExtendWindow() {
        // given
        startListening();
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 1)).block();
        advance(Duration.ofSeconds(45));

        // when
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 1)).block();
        advance(Duration.ofSeconds(15));

        // then
        assertThat(broker.published()).hasSize(1);
        advance(WINDOW);
        assertThat(broker.published()).hasSize(1);
    }

    @Test
    void queueEvent_afterFlush_startsNewCycle() {
        // given
        startListening();
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 1)).block();
        advance(WINDOW);

        // when
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f2", 5)).block();
        advance(WINDOW);

        // then
        assertThat(broker.published()).hasSize(2);
        assertThat(broker.published().get(1)).contains("\"f2\"").doesNotContain("\"f1\"");
    }

    @Test
    void queueEvent_concurrentEvents_deliversMergeExactlyOnce() throws Exception {
        // given
        startListening();

        // when
        Flux.range(0, 200)
                .parallel(8)
                .runOn(Schedulers.parallel())
                .flatMap(i -> publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES,
                        new NewArticlesDelta("f" + (i % 4), 1)))
                .sequential()
                .blockLast(Duration.ofSeconds(10));
        advance(WINDOW);

        // then
        assertThat(broker.published()).hasSize(1);
        var message = json(broker.published().get(0));
        assertThat(message.get("count").asLong()).isEqualTo(200);
        assertThat(message.get("feed_counts").get("f3").asLong()).isEqualTo(50);
        assertThat(metrics.getCounterValue(MonitoringConfig.QUEUED, "topic", "new_articles")).isEqualTo(200);
    }

    @Test
    void queueEvent_twoTopicsOfSameUser_deliveredSeparately() throws Exception {
        // given
        startListening();

        // when
        publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 2)).block();
        publisher.queueEvent(USER_ID, NotificationTopic.OPML_IMPORT_PROGRESS, new ImportProgressDelta("imp-1", 3, 10)).block();
        publisher.queueEvent(USER_ID, NotificationTopic.OPML_IMPORT_PROGRESS, new ImportProgressDelta("imp-1", 7, 10)).block();
        advance(WINDOW);

        // then
        assertThat(broker.published()).hasSize(2);
        var types = broker.published().stream().map(m -> m.contains("opml_import_progress")).toList();
        assertThat(types).containsExactlyInAnyOrder(true, false);
        var progress = broker.published().stream().filter(m -> m.contains("opml_import_progress")).findFirst().orElseThrow();
        var item = json(progress).get("imports").get(0);
        assertThat(item.get("current").asLong()).isEqualTo(7);
        assertThat(item.get("percentage").asInt()).isEqualTo(70);
    }

    @Test
    void queueEvent_blankUserId_isRejected() {
        assertThatThrownBy(() -> publisher.queueEvent(" ", NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void queueEvent_deltaOfAnotherTopic_isRejected() {
        assertThatThrownBy(() -> publisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES,
                new ImportProgressDelta("imp-1", 1, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("new_articles");
    }

    @Test
    void queueEvent_brokerFailure_completesAndCountsDrop() {
        // given
        var failingBroker = mock(NotificationBroker.class);
        given(failingBroker.incrementField(any(), any(), anyLong())).willReturn(Mono.error(new IllegalStateException("down")));
        var store = new DebounceStore(failingBroker, List.of(new NewArticlesAggregator(), new ImportProgressAggregator()));
        var failingPublisher = new NotificationPublisher(store, appProperties, metrics);

        // when
        StepVerifier.create(failingPublisher.queueEvent(USER_ID, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta("f1", 1)))
                .verifyComplete();

        // then
        then(failingBroker).should(never()).setIfAbsent(any(), any(), any());
        assertThat(metrics.getCounterValue(MonitoringConfig.DROPPED, "stage", "queue")).isEqualTo(1);
    }
}
