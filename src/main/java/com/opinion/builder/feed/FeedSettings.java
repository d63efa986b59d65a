package com.opinion.builder.feed;

import java.net.URI;
import java.time.Duration;

public record FeedSettings(
        URI endpoint,
        Duration heartbeatInterval,
        Duration livenessTimeout,
        Duration initialBackoff,
        Duration maxBackoff,
        double jitter
) {

    public FeedSettings {
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeat interval must be positive");
        }
        if (livenessTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("liveness timeout must exceed the heartbeat interval");
        }
    }

    public ReconnectBackoff backoff() {
        return new ReconnectBackoff(initialBackoff, maxBackoff, jitter);
    }
}
