package com.opinion.builder.feed;

import lombok.RequiredArgsConstructor;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.util.function.Function;

/**
 * {@link FeedTransport} over a Spring reactive {@link WebSocketClient}
 * (Reactor Netty in production).
 */
@RequiredArgsConstructor
public class ReactorNettyFeedTransport implements FeedTransport {

    private final WebSocketClient client;

    @Override
    public Mono<Void> connect(URI endpoint, Function<FeedSession, Mono<Void>> handler) {
        return client.execute(endpoint, ws -> {
            WsSession session = new WsSession(ws);
            return Mono.when(
                    ws.send(session.outbound.asFlux().map(ws::textMessage)),
                    handler.apply(session).doFinally(sig -> session.close()));
        }).onErrorMap(e -> !(e instanceof TransportFailureException),
                e -> new TransportFailureException("feed socket failed: " + e.getMessage(), e));
    }

    private static final class WsSession implements FeedSession {

        private final WebSocketSession ws;
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

        private WsSession(WebSocketSession ws) {
            this.ws = ws;
        }

        @Override
        public synchronized void send(String frame) {
            Sinks.EmitResult result = outbound.tryEmitNext(frame);
            if (result.isFailure()) {
                throw new TransportFailureException("cannot send on feed socket: " + result);
            }
        }

        @Override
        public Flux<String> receive() {
            return ws.receive().map(WebSocketMessage::getPayloadAsText);
        }

        private synchronized void close() {
            outbound.tryEmitComplete();
        }
    }
}
