package com.opinion.builder.config;

import com.opinion.builder.feed.FeedConnection;
import com.opinion.builder.feed.FeedEventListener;
import com.opinion.builder.feed.FeedSettings;
import com.opinion.builder.feed.FeedTransport;
import com.opinion.builder.feed.MessageDispatcher;
import com.opinion.builder.feed.ReactorNettyFeedTransport;
import com.opinion.builder.feed.SubscriptionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class FeedConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient opinionWebClient(WebClient.Builder builder,
                                      @Value("${opinion.sdk.base-url:https://api.opinion.trade}") String baseUrl,
                                      @Value("${opinion.sdk.api-key:}") String apiKey) {
        WebClient.Builder configured = builder.clone().baseUrl(baseUrl);
        if (!apiKey.isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return configured.build();
    }

    @Bean
    public FeedSettings feedSettings(@Value("${opinion.ws.url:wss://ws.opinion.trade}") String url,
                                     @Value("${opinion.ws.api-key:}") String apiKey,
                                     @Value("${opinion.ws.heartbeat-interval:30s}") Duration heartbeat,
                                     @Value("${opinion.ws.liveness-timeout:90s}") Duration liveness,
                                     @Value("${opinion.ws.reconnect.initial-delay:5s}") Duration initialDelay,
                                     @Value("${opinion.ws.reconnect.max-delay:60s}") Duration maxDelay,
                                     @Value("${opinion.ws.reconnect.jitter:0.2}") double jitter) {
        return new FeedSettings(endpoint(url, apiKey), heartbeat, liveness, initialDelay, maxDelay, jitter);
    }

    @Bean
    public FeedTransport feedTransport() {
        return new ReactorNettyFeedTransport(new ReactorNettyWebSocketClient());
    }

    @Bean
    public FeedConnection feedConnection(FeedTransport transport,
                                         SubscriptionRegistry registry,
                                         MessageDispatcher dispatcher,
                                         FeedEventListener listener,
                                         FeedSettings settings,
                                         Clock clock) {
        return new FeedConnection(transport, registry, dispatcher, listener, settings, settings.backoff(), clock);
    }

    static URI endpoint(String url, String apiKey) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(url);
        if (apiKey != null && !apiKey.isBlank()) {
            uri.queryParam("apikey", apiKey);
        }
        return uri.build().toUri();
    }
}
