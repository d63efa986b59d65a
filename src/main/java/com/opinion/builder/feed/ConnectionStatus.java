package com.opinion.builder.feed;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the feed connection. {@code lastMessageAt} and {@code sinceLastMessage} are null
 * until the first frame arrives.
 */
public record ConnectionStatus(
        ConnectionState state,
        Instant lastMessageAt,
        Duration sinceLastMessage,
        long reconnectAttempts,
        long framesReceived,
        int subscriptionsSent
) {

    public boolean connected() {
        return state == ConnectionState.ACTIVE;
    }
}
