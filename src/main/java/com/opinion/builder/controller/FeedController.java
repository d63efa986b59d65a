package com.opinion.builder.controller;

import com.opinion.builder.dto.SubscriptionRequest;
import com.opinion.builder.feed.ConnectionStatus;
import com.opinion.builder.feed.FeedChannel;
import com.opinion.builder.feed.FeedConnection;
import com.opinion.builder.feed.Subscription;
import com.opinion.builder.feed.SubscriptionRegistry;
import com.opinion.builder.service.FeedMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feed diagnostics and runtime edits of the subscription registry.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/feed")
@RequiredArgsConstructor
public class FeedController {

    private final FeedConnection connection;
    private final SubscriptionRegistry registry;
    private final FeedMetrics metrics;

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> m = describe(connection.status());
        m.put("desired_subscriptions", registry.size());
        m.putAll(metrics.totals());
        return m;
    }

    @GetMapping("/subscriptions")
    public List<String> subscriptions() {
        return registry.snapshot().stream().map(Subscription::toString).toList();
    }

    @PostMapping("/subscriptions")
    public ResponseEntity<Map<String, Object>> subscribe(@RequestBody SubscriptionRequest request) {
        Subscription subscription = toSubscription(request);
        boolean added = registry.add(subscription);
        log.info("Subscription {} {}", subscription, added ? "added" : "already present");
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK)
                .body(Map.of("subscription", subscription.toString(), "changed", added));
    }

    @DeleteMapping("/subscriptions")
    public Map<String, Object> unsubscribe(@RequestBody SubscriptionRequest request) {
        Subscription subscription = toSubscription(request);
        boolean removed = registry.remove(subscription);
        log.info("Subscription {} {}", subscription, removed ? "removed" : "was not present");
        return Map.of("subscription", subscription.toString(), "changed", removed);
    }

    static Subscription toSubscription(SubscriptionRequest request) {
        if (request == null || request.channel() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "channel required");
        }
        FeedChannel channel = FeedChannel.fromWireName(request.channel())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "unknown channel " + request.channel()));
        boolean byMarket = request.marketId() != null;
        boolean byRoot = request.rootMarketId() != null;
        if (byMarket == byRoot) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "exactly one of market_id and root_market_id required");
        }
        return byMarket
                ? Subscription.market(channel, request.marketId())
                : Subscription.rootMarket(channel, request.rootMarketId());
    }

    static Map<String, Object> describe(ConnectionStatus status) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("state", status.state().name());
        m.put("connected", status.connected());
        m.put("last_message_at", status.lastMessageAt() == null ? null : status.lastMessageAt().toString());
        m.put("seconds_since_last_message",
                status.sinceLastMessage() == null ? null : status.sinceLastMessage().toSeconds());
        m.put("reconnect_attempts", status.reconnectAttempts());
        m.put("frames_received", status.framesReceived());
        m.put("subscriptions_sent", status.subscriptionsSent());
        return m;
    }
}
