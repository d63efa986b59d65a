package com.opinion.builder.feed;

import java.util.Objects;

/**
 * A channel bound to one market, or to a root market for grouped (categorical) markets.
 */
public record Subscription(FeedChannel channel, long targetId, boolean rootMarket) {

    public Subscription {
        Objects.requireNonNull(channel, "channel");
    }

    public static Subscription market(FeedChannel channel, long marketId) {
        return new Subscription(channel, marketId, false);
    }

    public static Subscription rootMarket(FeedChannel channel, long rootMarketId) {
        return new Subscription(channel, rootMarketId, true);
    }

    @Override
    public String toString() {
        return channel.wireName() + (rootMarket ? "@root:" : "@") + targetId;
    }
}
