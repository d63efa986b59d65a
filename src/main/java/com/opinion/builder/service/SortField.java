package com.opinion.builder.service;

import com.opinion.builder.entity.Topic;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;

/**
 * Sortable topic fields. Missing values order as the lowest value.
 */
public enum SortField {
    END_DATE("end_date", Comparator.comparing((Topic t) -> t.endDate(),
            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))),
    CREATED_AT("created_at", Comparator.comparing((Topic t) -> t.createdAt(),
            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))),
    UPDATED_AT("updated_at", Comparator.comparing((Topic t) -> t.state().updatedAt(),
            Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))),
    VOLUME("volume", Comparator.comparing((Topic t) -> t.state().volume(),
            Comparator.nullsFirst(Comparator.<BigDecimal>naturalOrder()))),
    LAST_PRICE("last_price", Comparator.comparing((Topic t) -> t.state().lastPrice(),
            Comparator.nullsFirst(Comparator.<BigDecimal>naturalOrder())));

    private final String wireName;
    private final Comparator<Topic> comparator;

    SortField(String wireName, Comparator<Topic> comparator) {
        this.wireName = wireName;
        this.comparator = comparator;
    }

    public String wireName() {
        return wireName;
    }

    public Comparator<Topic> comparator() {
        return comparator;
    }

    public static SortField fromWireName(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortField field : values()) {
            if (field.wireName.equals(normalized)) {
                return field;
            }
        }
        throw new InvalidFilterException("sort.field", "unsupported sort field: " + value);
    }
}
