package com.opinion.builder.feed;

import com.opinion.builder.entity.OutcomeSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FeedMessageParserTest {

    private final FeedMessageParser parser = new FeedMessageParser();

    private MalformedMessageException.Reason reasonFor(String frame) {
        return assertThrows(MalformedMessageException.class, () -> parser.parse(frame)).getReason();
    }

    @Test
    void priceUpdate() {
        FeedMessage message = parser.parse(
                "{\"msgType\":\"market.last.price\",\"marketId\":2764,\"tokenId\":\"tok-yes\",\"outcomeSide\":1,\"price\":\"0.85\"}")
                .orElseThrow();

        FeedMessage.PriceUpdate price = assertInstanceOf(FeedMessage.PriceUpdate.class, message);
        assertEquals(2764L, price.marketId());
        assertEquals("tok-yes", price.tokenId());
        assertEquals(OutcomeSide.YES, price.outcomeSide());
        assertEquals(0, new BigDecimal("0.85").compareTo(price.price()));
    }

    @Test
    void numericPriceKeepsDecimalPrecision() {
        FeedMessage.PriceUpdate price = (FeedMessage.PriceUpdate) parser.parse(
                "{\"msgType\":\"market.last.price\",\"marketId\":\"7\",\"tokenId\":\"t\",\"outcomeSide\":2,\"price\":0.1}")
                .orElseThrow();

        assertEquals(new BigDecimal("0.1"), price.price());
        assertEquals(7L, price.marketId());
        assertEquals(OutcomeSide.NO, price.outcomeSide());
    }

    @Test
    void tradeUpdate() {
        FeedMessage.TradeUpdate trade = (FeedMessage.TradeUpdate) parser.parse(
                "{\"msgType\":\"market.last.trade\",\"marketId\":2764,\"tokenId\":\"t\",\"outcomeSide\":2,"
                        + "\"side\":\"Buy\",\"price\":\"0.15\",\"shares\":\"10\",\"amount\":\"1.5\"}")
                .orElseThrow();

        assertEquals("Buy", trade.side());
        assertEquals(new BigDecimal("0.15"), trade.price());
        assertEquals(new BigDecimal("10"), trade.shares());
        assertEquals(new BigDecimal("1.5"), trade.amount());
        assertEquals(FeedChannel.LAST_TRADE, trade.channel());
    }

    @Test
    void depthDiff() {
        FeedMessage message = parser.parse(
                "{\"msgType\":\"market.depth.diff\",\"marketId\":1,\"tokenId\":\"t\",\"outcomeSide\":1,"
                        + "\"side\":\"bids\",\"price\":\"0.5\",\"size\":\"0\"}")
                .orElseThrow();

        assertInstanceOf(FeedMessage.DepthDiff.class, message);
    }

    @Test
    void controlFramesAreEmpty() {
        assertTrue(parser.parse("{\"msgType\":\"PONG\"}").isEmpty());
        assertTrue(parser.parse("{\"msgType\":\"heartbeat\"}").isEmpty());
        assertTrue(parser.parse("{\"action\":\"SUBSCRIBE\",\"channel\":\"market.last.price\",\"marketId\":1}").isEmpty());
        assertTrue(parser.parse("{\"code\":200,\"message\":\"ok\"}").isEmpty());
    }

    @Test
    void malformedFrames() {
        assertEquals(MalformedMessageException.Reason.UNPARSEABLE, reasonFor("not json"));
        assertEquals(MalformedMessageException.Reason.UNPARSEABLE, reasonFor("[1,2]"));
        assertEquals(MalformedMessageException.Reason.UNPARSEABLE, reasonFor(""));
        assertEquals(MalformedMessageException.Reason.MISSING_FIELD, reasonFor("{\"marketId\":1}"));
        assertEquals(MalformedMessageException.Reason.UNKNOWN_TYPE,
                reasonFor("{\"msgType\":\"market.orderbook\",\"marketId\":1}"));
        assertEquals(MalformedMessageException.Reason.MISSING_FIELD,
                reasonFor("{\"msgType\":\"market.last.price\",\"marketId\":1,\"tokenId\":\"t\",\"outcomeSide\":1}"));
        assertEquals(MalformedMessageException.Reason.INVALID_VALUE,
                reasonFor("{\"msgType\":\"market.last.price\",\"marketId\":1,\"tokenId\":\"t\",\"outcomeSide\":3,\"price\":\"0.5\"}"));
        assertEquals(MalformedMessageException.Reason.INVALID_VALUE,
                reasonFor("{\"msgType\":\"market.last.price\",\"marketId\":1,\"tokenId\":\"t\",\"outcomeSide\":1,\"price\":\"abc\"}"));
        assertEquals(MalformedMessageException.Reason.INVALID_VALUE,
                reasonFor("{\"msgType\":\"market.last.price\",\"marketId\":\"x\",\"tokenId\":\"t\",\"outcomeSide\":1,\"price\":\"0.5\"}"));
        // 2^32 + 1 must not wrap around to YES
        assertEquals(MalformedMessageException.Reason.INVALID_VALUE,
                reasonFor("{\"msgType\":\"market.last.price\",\"marketId\":1,\"tokenId\":\"t\",\"outcomeSide\":4294967297,\"price\":\"0.85\"}"));
    }
}
