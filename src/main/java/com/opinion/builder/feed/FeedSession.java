package com.opinion.builder.feed;

import reactor.core.publisher.Flux;

/**
 * One open feed connection as seen by {@link FeedConnection}.
 */
public interface FeedSession {

    /**
     * Queues a text frame for sending.
     *
     * @throws TransportFailureException if the session can no longer send
     */
    void send(String frame);

    /** Inbound text frames; completes when the peer closes. */
    Flux<String> receive();
}
