package com.opinion.builder.dto;

/** Null values fall back to the configured defaults. */
public record Pagination(Integer limit, Integer offset) {

    public static Pagination defaults() {
        return new Pagination(null, null);
    }
}
