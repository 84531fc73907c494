package com.z254.horizon.client.impl;

import com.z254.horizon.client.AuthorityClientException;
import com.z254.horizon.client.ResourceAuthorityClient;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.AdaptationProposal;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * WebClient-based implementation of ResourceAuthorityClient.
 */
@Component
@Slf4j
public class WebClientResourceAuthorityClient implements ResourceAuthorityClient {

    private static final String AUTHORITY = "resource-authority";

    private final WebClient webClient;
    private final HorizonProperties.Clients.Endpoint config;
    private final boolean stubMode;

    public WebClientResourceAuthorityClient(HorizonProperties horizonProperties) {
        this.config = horizonProperties.getClients().getResourceAuthority();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isEmpty();

        if (!stubMode) {
            this.webClient = WebClient.builder()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Resource authority client running in stub mode - allocations will be granted");
        }
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "allocateForAdaptationFallback")
    @Retry(name = AUTHORITY)
    public Mono<AllocationResult> allocateForAdaptation(AdaptationProposal proposal) {
        if (stubMode) {
            return Mono.just(AllocationResult.grant());
        }

        return webClient.post()
                .uri("/api/v1/allocations")
                .bodyValue(proposal)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new AuthorityClientException(AUTHORITY, response.statusCode().value(), body)))
                .bodyToMono(AllocationResult.class)
                .timeout(config.getTimeout())
                .doOnSuccess(result -> log.debug("Allocation for {}: granted={}",
                        proposal.getId(), result != null && result.granted()))
                .doOnError(e -> log.error("Allocation request failed: proposalId={}, error={}",
                        proposal.getId(), e.getMessage()));
    }

    /**
     * Fallback when the resource authority is unavailable: treated as a denial.
     */
    public Mono<AllocationResult> allocateForAdaptationFallback(AdaptationProposal proposal, Throwable throwable) {
        log.warn("Resource authority unavailable for {}: {}", proposal.getId(), throwable.getMessage());
        return Mono.just(AllocationResult.denied("resource authority unavailable"));
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "redistributeVarietyFallback")
    @Retry(name = AUTHORITY)
    public Mono<Void> redistributeVariety(VarietyRedistributionRequest request) {
        if (stubMode) {
            log.debug("Stub mode - variety redistribution not sent: ratio={}", request.varietyRatio());
            return Mono.empty();
        }

        return webClient.post()
                .uri("/api/v1/variety/redistribute")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new AuthorityClientException(AUTHORITY, response.statusCode().value(), body)))
                .bodyToMono(Void.class)
                .timeout(config.getTimeout());
    }

    public Mono<Void> redistributeVarietyFallback(VarietyRedistributionRequest request, Throwable throwable) {
        log.error("Resource authority unavailable for variety redistribution: {}", throwable.getMessage());
        return Mono.empty();
    }
}
