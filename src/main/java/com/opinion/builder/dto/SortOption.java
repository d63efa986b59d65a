package com.opinion.builder.dto;

/**
 * Sort field ({@code end_date}, {@code created_at}, {@code volume}, {@code last_price},
 * {@code updated_at}) and order ({@code asc} or {@code desc}).
 */
public record SortOption(String field, String order) {

    public static final String DEFAULT_FIELD = "end_date";
    public static final String DEFAULT_ORDER = "asc";

    public SortOption {
        field = field == null || field.isBlank() ? DEFAULT_FIELD : field;
        order = order == null || order.isBlank() ? DEFAULT_ORDER : order;
    }

    public static SortOption defaults() {
        return new SortOption(DEFAULT_FIELD, DEFAULT_ORDER);
    }
}
