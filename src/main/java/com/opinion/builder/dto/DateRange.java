package com.opinion.builder.dto;

import java.time.Instant;

/** Inclusive range; either bound may be open. */
public record DateRange(Instant start, Instant end) {}
