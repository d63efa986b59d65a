package com.opinion.builder.feed;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay: {@code initial * 2^(attempt-1)}, capped at {@code max}, then
 * spread by a random factor in {@code [1 - jitter, 1 + jitter]} and capped again.
 */
public class ReconnectBackoff {

    private final Duration initial;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public ReconnectBackoff(Duration initial, Duration max, double jitter) {
        this(initial, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random source of values in {@code [0, 1)} */
    public ReconnectBackoff(Duration initial, Duration max, double jitter, DoubleSupplier random) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be positive: " + initial);
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff " + max + " is below initial " + initial);
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1): " + jitter);
        }
        this.initial = initial;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
    }

    /** @param attempt 1 for the first retry after a failure */
    public Duration delayFor(int attempt) {
        int exponent = Math.min(Math.max(attempt, 1) - 1, 30);
        long base = Math.min(max.toMillis(), initial.toMillis() * (1L << exponent));
        double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
        long jittered = Math.round(base * factor);
        return Duration.ofMillis(Math.max(1, Math.min(max.toMillis(), jittered)));
    }
}
