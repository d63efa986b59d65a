package com.opinion.builder.dto;

import java.util.Map;

public record HealthStatus(String status, boolean websocketConnected, Map<String, Object> websocketDetails, int cacheSize) {}
