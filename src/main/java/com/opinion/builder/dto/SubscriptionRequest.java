package com.opinion.builder.dto;

/** Exactly one of {@code marketId} and {@code rootMarketId} must be set. */
public record SubscriptionRequest(String channel, Long marketId, Long rootMarketId) {}
