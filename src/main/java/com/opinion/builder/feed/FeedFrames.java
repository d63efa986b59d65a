package com.opinion.builder.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outbound control frames.
 */
final class FeedFrames {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SUBSCRIBE = "SUBSCRIBE";
    static final String UNSUBSCRIBE = "UNSUBSCRIBE";
    static final String HEARTBEAT = "HEARTBEAT";

    private FeedFrames() {}

    static String subscribe(Subscription subscription) {
        return channelFrame(SUBSCRIBE, subscription);
    }

    static String unsubscribe(Subscription subscription) {
        return channelFrame(UNSUBSCRIBE, subscription);
    }

    static String heartbeat() {
        return MAPPER.createObjectNode().put("action", HEARTBEAT).toString();
    }

    private static String channelFrame(String action, Subscription subscription) {
        ObjectNode frame = MAPPER.createObjectNode()
                .put("action", action)
                .put("channel", subscription.channel().wireName());
        frame.put(subscription.rootMarket() ? "rootMarketId" : "marketId", subscription.targetId());
        return frame.toString();
    }
}
