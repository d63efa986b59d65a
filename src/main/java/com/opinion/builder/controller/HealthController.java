package com.opinion.builder.controller;

import com.opinion.builder.dto.HealthStatus;
import com.opinion.builder.feed.ConnectionStatus;
import com.opinion.builder.feed.FeedConnection;
import com.opinion.builder.service.TopicStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final FeedConnection connection;
    private final TopicStore store;

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("message", "Opinion Builder Tools API");
        m.put("version", "0.1.0");
        m.put("health", "/health");
        return m;
    }

    /** Degraded while the feed is not active; queries keep working either way. */
    @GetMapping("/health")
    public HealthStatus health() {
        ConnectionStatus status = connection.status();
        return new HealthStatus(
                status.connected() ? "healthy" : "degraded",
                status.connected(),
                FeedController.describe(status),
                store.size());
    }
}
