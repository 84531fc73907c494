package com.z254.horizon.client.impl;

import com.z254.horizon.client.AuthorityClientException;
import com.z254.horizon.client.SignalSourceClient;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.*;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * WebClient-based implementation of SignalSourceClient.
 * In stub mode it serves a fixed baseline signal set.
 */
@Component
@Slf4j
public class WebClientSignalSourceClient implements SignalSourceClient {

    private static final String SOURCE = "signal-source";

    private final WebClient webClient;
    private final HorizonProperties.Clients.Endpoint config;
    private final boolean stubMode;

    public WebClientSignalSourceClient(HorizonProperties horizonProperties) {
        this.config = horizonProperties.getClients().getSignalSource();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isEmpty();

        if (!stubMode) {
            this.webClient = WebClient.builder()
                    .baseUrl(config.getBaseUrl())
                    .build();
        } else {
            this.webClient = null;
            log.warn("Signal source client running in stub mode - serving baseline signals");
        }
    }

    @Override
    @CircuitBreaker(name = SOURCE)
    public Mono<SignalSnapshot> fetchSnapshot(Set<SignalFamily> families) {
        if (stubMode) {
            return Mono.fromCallable(() -> baseline(families));
        }

        String familyParam = families.stream()
                .map(f -> f.name().toLowerCase())
                .sorted()
                .collect(Collectors.joining(","));

        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/v1/signals")
                        .queryParam("families", familyParam)
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new AuthorityClientException(SOURCE, response.statusCode().value(), body)))
                .bodyToMono(SignalSnapshot.class)
                .timeout(config.getTimeout())
                .doOnError(e -> log.error("Signal fetch failed: families={}, error={}", familyParam, e.getMessage()));
    }

    // ========== Private Helper Methods ==========

    private SignalSnapshot baseline(Set<SignalFamily> families) {
        SignalSnapshot.SignalSnapshotBuilder builder = SignalSnapshot.builder().timestamp(Instant.now());
        if (families.contains(SignalFamily.MARKET)) {
            builder.marketSignals(List.of(
                    new MarketSignal("increased_demand", 0.7, "sales_data"),
                    new MarketSignal("price_pressure", 0.4, "market_analysis"),
                    new MarketSignal("new_segment_emerging", 0.6, "customer_feedback")));
        }
        if (families.contains(SignalFamily.TECHNOLOGY)) {
            builder.technologyTrends(List.of(
                    new TechnologyTrend("ai_adoption", SignalLevel.HIGH, "6_months"),
                    new TechnologyTrend("edge_computing", SignalLevel.MEDIUM, "12_months")));
        }
        if (families.contains(SignalFamily.REGULATORY)) {
            builder.regulatoryUpdates(List.of(
                    new RegulatoryUpdate("data_privacy", "proposed", SignalLevel.MEDIUM)));
        }
        if (families.contains(SignalFamily.COMPETITIVE)) {
            builder.competitiveMoves(List.of(
                    new CompetitiveMove("comp_a", "new_product", SignalLevel.MEDIUM)));
        }
        return builder.build();
    }
}
