package com.opinion.builder.feed;

import com.opinion.builder.events.ConnectionStateChange;
import com.opinion.builder.events.ReconnectAttempt;

/**
 * Observer hooks for the feed pipeline. The feed classes report through these hooks and never
 * log themselves.
 * <p>
 * Frame hooks ({@code onMessageApplied} through {@code onFrameFailed}) run on the single feed loop
 * thread. Connection hooks run on whichever thread drives the connection at that moment: the
 * caller of {@code start()} or {@code stop()}, a Netty I/O thread, or the reconnect timer. Every
 * hook called by {@link FeedConnection} runs while it holds its dispatch lock, so none fires after
 * {@code stop()} returns. Implementations must return quickly and never throw.
 */
public interface FeedEventListener {

    FeedEventListener NOOP = new FeedEventListener() {};

    default void onMessageApplied(FeedMessage message) {}

    default void onDepthDiff(FeedMessage.DepthDiff diff) {}

    default void onUnknownEntity(FeedMessage message) {}

    default void onMalformedMessage(String frame, MalformedMessageException error) {}

    /** A frame that parsed but could not be applied. The session carries on. */
    default void onFrameFailed(String frame, RuntimeException error) {}

    default void onStateChange(ConnectionStateChange change) {}

    default void onReconnectScheduled(ReconnectAttempt attempt) {}

    default void onSubscriptionSent(Subscription subscription) {}

    default void onUnsubscriptionSent(Subscription subscription) {}

    /** The connect loop gave up while the connection was still meant to run. */
    default void onFeedLoopEnded(Throwable cause) {}
}
