package com.opinion.builder.feed;

import com.opinion.builder.entity.OutcomeSide;

import java.math.BigDecimal;

/**
 * Inbound market update, one case per {@code msgType}. Built by {@link FeedMessageParser}.
 */
public sealed interface FeedMessage {

    long marketId();

    String tokenId();

    OutcomeSide outcomeSide();

    FeedChannel channel();

    /** {@code market.last.price} */
    record PriceUpdate(long marketId, String tokenId, OutcomeSide outcomeSide, BigDecimal price) implements FeedMessage {
        @Override
        public FeedChannel channel() {
            return FeedChannel.LAST_PRICE;
        }
    }

    /** {@code market.last.trade}; {@code side} is Buy or Sell, {@code amount} the traded notional. */
    record TradeUpdate(long marketId, String tokenId, OutcomeSide outcomeSide, String side,
                       BigDecimal price, BigDecimal shares, BigDecimal amount) implements FeedMessage {
        @Override
        public FeedChannel channel() {
            return FeedChannel.LAST_TRADE;
        }
    }

    /** {@code market.depth.diff}; {@code side} is bids or asks. */
    record DepthDiff(long marketId, String tokenId, OutcomeSide outcomeSide, String side,
                     BigDecimal price, BigDecimal size) implements FeedMessage {
        @Override
        public FeedChannel channel() {
            return FeedChannel.DEPTH_DIFF;
        }
    }
}
