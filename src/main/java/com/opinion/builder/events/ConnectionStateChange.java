package com.opinion.builder.events;

import com.opinion.builder.feed.ConnectionState;

import java.time.Instant;

/**
 * Published on every feed connection transition. {@code reason} is null for planned moves.
 */
public record ConnectionStateChange(ConnectionState from, ConnectionState to, Instant at, String reason) {}
