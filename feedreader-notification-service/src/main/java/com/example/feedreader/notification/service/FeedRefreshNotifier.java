package com.example.feedreader.notification.service;

import com.example.feedreader.notification.repository.UserFeedRepository;
import com.example.feedreader.notification.topic.NewArticlesDelta;
import com.example.feedreader.notification.topic.NotificationTopic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Queues {@code new_articles} notifications for every subscriber once a feed
 * refresh stored new articles.
 */
@Service
@Slf4j
public class FeedRefreshNotifier {

    private final UserFeedRepository userFeedRepository;
    private final NotificationPublisher notificationPublisher;
    private final Scheduler jdbcScheduler;

    public FeedRefreshNotifier(UserFeedRepository userFeedRepository,
                               NotificationPublisher notificationPublisher,
                               @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.userFeedRepository = userFeedRepository;
        this.notificationPublisher = notificationPublisher;
        this.jdbcScheduler = jdbcScheduler;
    }

    /**
     * @return the number of subscribers notified
     */
    public Mono<Integer> onFeedRefreshed(String feedId, long articlesCreated) {
        if (articlesCreated <= 0) {
            return Mono.just(0);
        }
        return Mono.fromCallable(() -> userFeedRepository.findSubscribedUserIds(feedId))
                .subscribeOn(jdbcScheduler)
                .flatMapMany(Flux::fromIterable)
                .concatMap(userId -> notificationPublisher
                        .queueEvent(userId, NotificationTopic.NEW_ARTICLES, new NewArticlesDelta(feedId, articlesCreated))
                        .thenReturn(userId))
                .count()
                .map(Long::intValue)
                .doOnNext(subscribers -> log.debug("Queued {} new articles of feed {} for {} subscribers",
                        articlesCreated, feedId, subscribers))
                .onErrorResume(e -> {
                    log.error("Failed to notify subscribers of feed {}: {}", feedId, e.getMessage());
                    return Mono.just(0);
                });
    }
}
