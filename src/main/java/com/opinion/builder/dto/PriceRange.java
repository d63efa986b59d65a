package com.opinion.builder.dto;

/** Price bounds as decimal strings, e.g. {@code "0.25"}. Either bound may be open. */
public record PriceRange(String min, String max) {}
