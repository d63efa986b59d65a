package com.opinion.builder.dto;

import com.opinion.builder.entity.Topic;

public record TopicDetailResponse(Topic data) {}
