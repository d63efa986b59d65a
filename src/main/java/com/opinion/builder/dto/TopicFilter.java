package com.opinion.builder.dto;

import com.opinion.builder.entity.OutcomeType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Conjunction of optional criteria. Empty lists and null ranges don't restrict the result.
 */
@Builder
public record TopicFilter(
        DateRange endDateRange,
        List<OutcomeType> outcomeTypes,
        List<String> categories,
        List<String> keywords,
        List<String> excludeKeywords,
        PriceRange priceRange,
        BigDecimal minVolume,
        BigDecimal maxVolume,
        Instant createdAfter
) {

    public TopicFilter {
        outcomeTypes = outcomeTypes == null ? List.of() : outcomeTypes;
        categories = categories == null ? List.of() : categories;
        keywords = keywords == null ? List.of() : keywords;
        excludeKeywords = excludeKeywords == null ? List.of() : excludeKeywords;
    }

    public static TopicFilter none() {
        return TopicFilter.builder().build();
    }
}
