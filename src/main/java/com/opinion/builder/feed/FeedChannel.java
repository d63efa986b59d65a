package com.opinion.builder.feed;

import java.util.Optional;

/**
 * Feed channels. The wire name doubles as the {@code msgType} of inbound frames.
 */
public enum FeedChannel {
    DEPTH_DIFF("market.depth.diff"),
    LAST_PRICE("market.last.price"),
    LAST_TRADE("market.last.trade");

    private final String wireName;

    FeedChannel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FeedChannel> fromWireName(String value) {
        for (FeedChannel channel : values()) {
            if (channel.wireName.equals(value)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
