package com.opinion.builder.dto;

public record TopicFilterRequest(TopicFilter filters, SortOption sort, Pagination pagination) {}
