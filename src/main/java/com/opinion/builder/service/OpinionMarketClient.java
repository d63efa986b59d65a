package com.opinion.builder.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * REST client for the market listing used to build the initial snapshot.
 */
@Slf4j
@Service
public class OpinionMarketClient {

    private final WebClient webClient;

    public OpinionMarketClient(@Qualifier("opinionWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /** Active markets, raw. A body without a {@code markets} array yields an empty list. */
    public Mono<List<JsonNode>> fetchMarkets(int limit, int offset) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/markets")
                        .queryParam("limit", limit)
                        .queryParam("offset", offset)
                        .queryParam("active", true)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(body -> {
                    JsonNode markets = body.path("markets");
                    if (!markets.isArray()) {
                        log.warn("Market listing has no 'markets' array");
                        return List.<JsonNode>of();
                    }
                    List<JsonNode> out = new ArrayList<>(markets.size());
                    markets.forEach(out::add);
                    return out;
                })
                .defaultIfEmpty(List.of());
    }
}
