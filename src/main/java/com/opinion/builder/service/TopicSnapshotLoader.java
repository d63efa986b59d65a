package com.opinion.builder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.opinion.builder.entity.MarketState;
import com.opinion.builder.entity.OutcomeType;
import com.opinion.builder.entity.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One-shot load of the market listing into {@link TopicStore}. Records that can't be turned
 * into a topic are skipped and counted.
 */
@Slf4j
@Service
public class TopicSnapshotLoader {

    private final OpinionMarketClient client;
    private final TopicStore store;
    private final Clock clock;
    private final int snapshotLimit;

    public TopicSnapshotLoader(OpinionMarketClient client,
                               TopicStore store,
                               Clock clock,
                               @Value("${opinion.sdk.snapshot-limit:500}") int snapshotLimit) {
        this.client = client;
        this.store = store;
        this.clock = clock;
        this.snapshotLimit = snapshotLimit;
    }

    public record Result(int loaded, int skipped) {}

    public Mono<Result> load() {
        return client.fetchMarkets(snapshotLimit, 0)
                .map(markets -> {
                    Instant now = clock.instant();
                    int loaded = 0;
                    int skipped = 0;
                    for (JsonNode market : markets) {
                        Optional<Topic> topic = toTopic(market, now);
                        if (topic.isPresent()) {
                            store.upsertStatic(topic.get());
                            loaded++;
                        } else {
                            skipped++;
                        }
                    }
                    log.info("Snapshot loaded: {} topics ({} skipped), store size {}", loaded, skipped, store.size());
                    return new Result(loaded, skipped);
                });
    }

    static Optional<Topic> toTopic(JsonNode market, Instant now) {
        JsonNode idNode = market.get("id");
        if (idNode == null || !(idNode.canConvertToLong() || idNode.isTextual())) {
            log.warn("Skipping market without id");
            return Optional.empty();
        }
        long marketId;
        try {
            marketId = idNode.isTextual() ? Long.parseLong(idNode.asText().trim()) : idNode.asLong();
        } catch (NumberFormatException e) {
            log.warn("Skipping market with non-numeric id '{}'", idNode.asText());
            return Optional.empty();
        }
        if (marketId <= 0) {
            log.warn("Skipping market with id {}", marketId);
            return Optional.empty();
        }

        OutcomeType outcomeType;
        try {
            outcomeType = OutcomeType.fromWireName(text(market, "outcomeType"));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping market {}: unknown outcome type '{}'", marketId, text(market, "outcomeType"));
            return Optional.empty();
        }

        Instant updatedAt = instant(market, "updatedAt");
        MarketState state = new MarketState(
                decimal(market, "lastPrice"),
                decimal(market, "yesPrice"),
                decimal(market, "noPrice"),
                decimal(market, "volume"),
                decimal(market, "liquidity"),
                updatedAt == null ? now : updatedAt);

        List<String> categories = new ArrayList<>();
        market.path("categories").forEach(c -> {
            if (c.isTextual() && !c.asText().isBlank()) {
                categories.add(c.asText());
            }
        });

        return Optional.of(Topic.builder()
                .id(String.valueOf(marketId))
                .marketId(marketId)
                .question(text(market, "question"))
                .description(text(market, "description"))
                .endDate(instant(market, "endDate"))
                .outcomeType(outcomeType)
                .categories(categories)
                .slug(text(market, "slug"))
                .createdAt(instant(market, "createdAt"))
                .state(state)
                .build());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {} '{}'", field, value.asText());
            return null;
        }
    }

    /** ISO-8601 with offset or 'Z'; unparseable values read as absent. */
    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable {} '{}'", field, value);
            return null;
        }
    }
}
