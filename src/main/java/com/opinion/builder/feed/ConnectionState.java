package com.opinion.builder.feed;

/**
 * Lifecycle of the feed connection. Only {@link FeedConnection} changes it.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBING,
    ACTIVE,
    RECONNECTING
}
