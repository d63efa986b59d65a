package com.opinion.builder.events;

import java.time.Duration;

/**
 * A reconnect was scheduled after the connection failed.
 */
public record ReconnectAttempt(int attempt, Duration delay, Throwable cause) {}
