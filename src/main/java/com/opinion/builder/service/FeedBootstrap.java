package com.opinion.builder.service;

import com.opinion.builder.entity.Topic;
import com.opinion.builder.feed.FeedChannel;
import com.opinion.builder.feed.FeedConnection;
import com.opinion.builder.feed.Subscription;
import com.opinion.builder.feed.SubscriptionRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Startup order: snapshot, then subscriptions for every loaded topic, then the feed.
 * A failed snapshot leaves the store empty but the service up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedBootstrap {

    private final TopicSnapshotLoader snapshotLoader;
    private final TopicStore store;
    private final SubscriptionRegistry registry;
    private final FeedConnection connection;

    @Value("${opinion.ws.enabled:true}")
    private boolean feedEnabled;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Opinion builder starting: loading snapshot");
        snapshotLoader.load()
                .doOnError(e -> log.error("❌ Initial snapshot failed, continuing with {} topics", store.size(), e))
                .onErrorResume(e -> Mono.empty())
                .then(Mono.fromRunnable(this::subscribeAndConnect))
                .subscribe(
                        v -> { },
                        e -> log.error("❌ Feed startup failed", e));
    }

    void subscribeAndConnect() {
        int added = 0;
        List<Topic> topics = store.getAll().stream()
                .sorted(Comparator.comparingLong(Topic::marketId))
                .toList();
        for (Topic topic : topics) {
            for (Subscription subscription : subscriptionsFor(topic)) {
                if (registry.add(subscription)) {
                    added++;
                }
            }
        }
        log.info("Planned {} subscriptions for {} topics", added, topics.size());

        if (feedEnabled) {
            connection.start();
        } else {
            log.info("Realtime feed disabled (opinion.ws.enabled=false)");
        }
    }

    /**
     * Categorical markets stream prices under their root market; everything else gets price,
     * trade and depth by market id.
     */
    public static List<Subscription> subscriptionsFor(Topic topic) {
        if (topic.isCategorical()) {
            return List.of(Subscription.rootMarket(FeedChannel.LAST_PRICE, topic.marketId()));
        }
        return List.of(
                Subscription.market(FeedChannel.LAST_PRICE, topic.marketId()),
                Subscription.market(FeedChannel.DEPTH_DIFF, topic.marketId()),
                Subscription.market(FeedChannel.LAST_TRADE, topic.marketId()));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping realtime feed");
        connection.stop();
    }
}
