package com.opinion.builder.entity;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Latest known state of one prediction market. Descriptive fields come from the initial
 * snapshot and never change afterwards; {@link #state()} is replaced as feed updates arrive.
 */
@Builder(toBuilder = true)
public record Topic(
        String id,
        long marketId,
        String question,
        String description,
        Instant endDate,
        OutcomeType outcomeType,
        List<String> categories,
        String slug,
        Instant createdAt,
        @JsonUnwrapped MarketState state
) {

    public Topic {
        id = id == null || id.isBlank() ? String.valueOf(marketId) : id;
        question = question == null ? "" : question;
        outcomeType = outcomeType == null ? OutcomeType.BINARY : outcomeType;
        categories = categories == null ? List.of() : List.copyOf(categories);
        state = state == null ? MarketState.empty(null) : state;
    }

    public Topic withState(MarketState next) {
        return new Topic(id, marketId, question, description, endDate, outcomeType, categories, slug, createdAt, next);
    }

    public boolean isCategorical() {
        return outcomeType == OutcomeType.CATEGORICAL;
    }
}
