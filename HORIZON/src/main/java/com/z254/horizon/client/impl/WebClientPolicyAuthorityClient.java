package com.z254.horizon.client.impl;

import com.z254.horizon.client.AuthorityClientException;
import com.z254.horizon.client.PolicyAuthorityClient;
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

import java.time.Instant;

/**
 * WebClient-based implementation of PolicyAuthorityClient.
 * Runs in stub mode when no base URL is configured: proposals are approved and
 * notifications are only logged.
 */
@Component
@Slf4j
public class WebClientPolicyAuthorityClient implements PolicyAuthorityClient {

    private static final String AUTHORITY = "policy-authority";

    private final WebClient webClient;
    private final HorizonProperties.Clients.Endpoint config;
    private final boolean stubMode;

    public WebClientPolicyAuthorityClient(HorizonProperties horizonProperties) {
        this.config = horizonProperties.getClients().getPolicyAuthority();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isEmpty();

        if (!stubMode) {
            this.webClient = WebClient.builder()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Policy authority client running in stub mode - adaptations will auto-approve");
        }
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "approveAdaptationFallback")
    @Retry(name = AUTHORITY)
    public Mono<AdaptationDecision> approveAdaptation(AdaptationProposal proposal) {
        if (stubMode) {
            return Mono.just(new AdaptationDecision(proposal.getId(), true,
                    "Stub mode - auto-approved", Instant.now()));
        }

        log.info("Submitting adaptation for approval: proposalId={}, model={}",
                proposal.getId(), proposal.getModelType());
        return webClient.post()
                .uri("/api/v1/adaptations/approve")
                .bodyValue(proposal)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new AuthorityClientException(AUTHORITY, response.statusCode().value(), body)))
                .bodyToMono(AdaptationDecision.class)
                .timeout(config.getTimeout())
                .doOnSuccess(decision -> log.info("Adaptation decision: proposalId={}, approved={}",
                        proposal.getId(), decision != null && decision.approved()))
                .doOnError(e -> log.error("Adaptation approval failed: proposalId={}, error={}",
                        proposal.getId(), e.getMessage()));
    }

    /**
     * Fallback when the policy authority is unavailable: the proposal is not approved.
     */
    public Mono<AdaptationDecision> approveAdaptationFallback(AdaptationProposal proposal, Throwable throwable) {
        log.warn("Policy authority unavailable, proposal {} left unapproved: {}",
                proposal.getId(), throwable.getMessage());
        return Mono.just(new AdaptationDecision(proposal.getId(), false,
                "Policy authority unavailable", Instant.now()));
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "spawnMetaSystemEmergencyFallback")
    @Retry(name = AUTHORITY)
    public Mono<Void> spawnMetaSystemEmergency(MetaSystemSpawnRequest request) {
        log.warn("Requesting emergency meta-system: ratio={}, risk={}, urgency={}",
                request.varietyRatio(), request.explosionRisk(), request.urgency());
        return post("/api/v1/meta-systems/emergency", request);
    }

    public Mono<Void> spawnMetaSystemEmergencyFallback(MetaSystemSpawnRequest request, Throwable throwable) {
        log.error("Policy authority unavailable for meta-system spawn: ratio={}, error={}",
                request.varietyRatio(), throwable.getMessage());
        return Mono.empty();
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "handleCascadeRiskFallback")
    @Retry(name = AUTHORITY)
    public Mono<Void> handleCascadeRisk(CascadeRiskReport report) {
        log.warn("Reporting cascade risk: containment={}, recommended={}",
                report.prediction().getContainmentProbability(), report.recommendedAction());
        return post("/api/v1/cascade-risks", report);
    }

    public Mono<Void> handleCascadeRiskFallback(CascadeRiskReport report, Throwable throwable) {
        log.error("Policy authority unavailable for cascade risk report: {}", throwable.getMessage());
        return Mono.empty();
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "handlePatternEmergenceFallback")
    @Retry(name = AUTHORITY)
    public Mono<Void> handlePatternEmergence(PatternEmergenceNotice notice) {
        log.info("Reporting pattern emergence: emergent={}, meta={}",
                notice.emergentPatterns(), notice.metaPatterns());
        return post("/api/v1/pattern-emergence", notice);
    }

    public Mono<Void> handlePatternEmergenceFallback(PatternEmergenceNotice notice, Throwable throwable) {
        log.error("Policy authority unavailable for pattern emergence notice: {}", throwable.getMessage());
        return Mono.empty();
    }

    @Override
    @CircuitBreaker(name = AUTHORITY, fallbackMethod = "proposeSystemEvolutionFallback")
    @Retry(name = AUTHORITY)
    public Mono<Void> proposeSystemEvolution(SystemEvolutionProposal proposal) {
        log.info("Proposing system evolution: type={}, urgency={}",
                proposal.evolutionType(), proposal.urgency());
        return post("/api/v1/evolution-proposals", proposal);
    }

    public Mono<Void> proposeSystemEvolutionFallback(SystemEvolutionProposal proposal, Throwable throwable) {
        log.error("Policy authority unavailable for evolution proposal {}: {}",
                proposal.evolutionType(), throwable.getMessage());
        return Mono.empty();
    }

    // ========== Private Helper Methods ==========

    private Mono<Void> post(String uri, Object body) {
        if (stubMode) {
            log.debug("Stub mode - not sending {} to policy authority", uri);
            return Mono.empty();
        }
        return webClient.post()
                .uri(uri)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new AuthorityClientException(AUTHORITY, response.statusCode().value(), text)))
                .bodyToMono(Void.class)
                .timeout(config.getTimeout());
    }
}
