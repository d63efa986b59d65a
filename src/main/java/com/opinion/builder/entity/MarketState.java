package com.opinion.builder.entity;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The streaming-updated part of a {@link Topic}. Instances are immutable; every update
 * produces a new value so readers never see a half-applied message.
 */
public record MarketState(
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal lastPrice,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal yesPrice,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal noPrice,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal volume,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal liquidity,
        Instant updatedAt
) {

    public static MarketState empty(Instant at) {
        return new MarketState(null, null, null, null, null, at);
    }

    /** Last price plus the price of the given side. */
    public MarketState withPrice(OutcomeSide side, BigDecimal price, Instant at) {
        BigDecimal yes = side == OutcomeSide.YES ? price : yesPrice;
        BigDecimal no = side == OutcomeSide.NO ? price : noPrice;
        return new MarketState(price, yes, no, volume, liquidity, at);
    }

    /** A trade moves the prices like a price update and adds its notional to the volume. */
    public MarketState withTrade(OutcomeSide side, BigDecimal price, BigDecimal amount, Instant at) {
        MarketState priced = withPrice(side, price, at);
        BigDecimal newVolume = volume == null ? amount : volume.add(amount);
        return new MarketState(priced.lastPrice, priced.yesPrice, priced.noPrice, newVolume, liquidity, at);
    }
}
