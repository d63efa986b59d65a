package com.opinion.builder.feed;

import com.opinion.builder.service.TopicStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Routes parsed feed messages into {@link TopicStore}. Stateless; ordering per market comes
 * from the single feed loop that calls it.
 */
@Component
@RequiredArgsConstructor
public class MessageDispatcher {

    private final FeedMessageParser parser;
    private final TopicStore store;
    private final FeedEventListener listener;
    private final Clock clock;

    public DispatchOutcome dispatch(String frame) {
        Optional<FeedMessage> parsed;
        try {
            parsed = parser.parse(frame);
        } catch (MalformedMessageException e) {
            listener.onMalformedMessage(frame, e);
            return DispatchOutcome.MALFORMED;
        }
        return parsed.map(this::apply).orElse(DispatchOutcome.IGNORED);
    }

    public DispatchOutcome apply(FeedMessage message) {
        if (message instanceof FeedMessage.DepthDiff diff) {
            // order book diffs don't feed last/yes/no price
            listener.onDepthDiff(diff);
            return DispatchOutcome.IGNORED;
        }

        Instant now = clock.instant();
        boolean applied;
        if (message instanceof FeedMessage.PriceUpdate price) {
            applied = store.applyMutation(price.marketId(),
                    state -> state.withPrice(price.outcomeSide(), price.price(), now));
        } else if (message instanceof FeedMessage.TradeUpdate trade) {
            applied = store.applyMutation(trade.marketId(),
                    state -> state.withTrade(trade.outcomeSide(), trade.price(), trade.amount(), now));
        } else {
            throw new IllegalStateException("Unhandled feed message " + message.getClass().getSimpleName());
        }

        if (!applied) {
            listener.onUnknownEntity(message);
            return DispatchOutcome.UNKNOWN_ENTITY;
        }
        listener.onMessageApplied(message);
        return DispatchOutcome.APPLIED;
    }
}
