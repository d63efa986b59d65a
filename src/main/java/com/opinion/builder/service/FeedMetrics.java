package com.opinion.builder.service;

import com.opinion.builder.events.ConnectionStateChange;
import com.opinion.builder.events.ReconnectAttempt;
import com.opinion.builder.feed.FeedEventListener;
import com.opinion.builder.feed.FeedMessage;
import com.opinion.builder.feed.MalformedMessageException;
import com.opinion.builder.feed.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counts what the feed does and logs a summary every interval. Window counters reset after
 * each summary; totals don't. This is also where the feed's own events get logged.
 */
@Slf4j
@Component
public class FeedMetrics implements FeedEventListener {

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong depthDiffs = new AtomicLong();
    private final AtomicLong unknownEntities = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong totalApplied = new AtomicLong();
    private final AtomicLong totalDropped = new AtomicLong();
    private final AtomicReference<String> lastMalformed = new AtomicReference<>("");

    @Value("${opinion.metrics.summary-interval-ms:60000}")
    private long summaryIntervalMs;

    @Override
    public void onMessageApplied(FeedMessage message) {
        applied.incrementAndGet();
        totalApplied.incrementAndGet();
    }

    @Override
    public void onDepthDiff(FeedMessage.DepthDiff diff) {
        depthDiffs.incrementAndGet();
    }

    @Override
    public void onUnknownEntity(FeedMessage message) {
        unknownEntities.incrementAndGet();
        totalDropped.incrementAndGet();
        log.debug("No topic for market {} ({}), dropped", message.marketId(), message.channel().wireName());
    }

    @Override
    public void onMalformedMessage(String frame, MalformedMessageException error) {
        malformed.incrementAndGet();
        totalDropped.incrementAndGet();
        lastMalformed.set(error.getReason() + ": " + error.getMessage());
        log.debug("Dropping malformed frame ({}): {}", error.getReason(), error.getMessage());
    }

    @Override
    public void onFrameFailed(String frame, RuntimeException error) {
        failed.incrementAndGet();
        totalDropped.incrementAndGet();
        log.error("Failed to apply feed frame, continuing: {}", frame, error);
    }

    @Override
    public void onStateChange(ConnectionStateChange change) {
        String reason = change.reason() == null ? "" : " (" + change.reason() + ")";
        log.info("Feed connection {} → {}{}", change.from(), change.to(), reason);
    }

    @Override
    public void onReconnectScheduled(ReconnectAttempt attempt) {
        reconnects.incrementAndGet();
        log.warn("Feed connection lost ({}); reconnect #{} in {} ms",
                attempt.cause().getMessage(), attempt.attempt(), attempt.delay().toMillis());
    }

    @Override
    public void onSubscriptionSent(Subscription subscription) {
        log.debug("Subscribed {}", subscription);
    }

    @Override
    public void onUnsubscriptionSent(Subscription subscription) {
        log.info("Unsubscribed {}", subscription);
    }

    @Override
    public void onFeedLoopEnded(Throwable cause) {
        log.error("Feed loop ended while running; no further reconnects", cause);
    }

    @Scheduled(fixedDelayString = "${opinion.metrics.summary-interval-ms:60000}",
            initialDelayString = "${opinion.metrics.summary-interval-ms:60000}")
    public void logSummary() {
        long ok = applied.getAndSet(0);
        long depth = depthDiffs.getAndSet(0);
        long unknown = unknownEntities.getAndSet(0);
        long bad = malformed.getAndSet(0);
        long retries = reconnects.getAndSet(0);
        long errors = failed.getAndSet(0);
        log.info("Feed summary: applied={}, depthDiffs={}, unknown={}, failed={}, reconnects={} (last {}s)",
                ok, depth, unknown, errors, retries, summaryIntervalMs / 1000);
        if (bad > 0) {
            log.warn("Feed dropped {} malformed frames, last: {}", bad, lastMalformed.getAndSet(""));
        }
    }

    /** Lifetime totals for the status endpoint. */
    public Map<String, Object> totals() {
        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("messages_applied", totalApplied.get());
        totals.put("messages_dropped", totalDropped.get());
        return totals;
    }
}
