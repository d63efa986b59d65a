package com.opinion.builder.dto;

import com.opinion.builder.entity.Topic;

import java.util.List;

public record TopicListResponse(List<Topic> items, int total, int limit, int offset) {}
