package com.opinion.builder.feed;

import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.function.Function;

/**
 * Opens feed sessions. The returned Mono completes when the session ends and errors when it
 * could not be opened or failed.
 */
public interface FeedTransport {

    Mono<Void> connect(URI endpoint, Function<FeedSession, Mono<Void>> handler);
}
