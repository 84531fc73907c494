package com.z254.horizon.client.impl;

import com.z254.horizon.client.ResourceAuthorityClient.VarietyRedistributionRequest;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.AdaptationProposal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientResourceAuthorityClientTest {

    private static final AdaptationProposal PROPOSAL = AdaptationProposal.builder().id("proposal-1").build();

    @Test
    @DisplayName("should grant allocations in stub mode")
    void stubGrants() {
        WebClientResourceAuthorityClient client = new WebClientResourceAuthorityClient(new HorizonProperties());

        StepVerifier.create(client.allocateForAdaptation(PROPOSAL))
                .assertNext(result -> assertThat(result.granted()).isTrue())
                .verifyComplete();
        StepVerifier.create(client.redistributeVariety(
                        new VarietyRedistributionRequest(2.5, 1.0, 2.5, 1.0, Instant.EPOCH)))
                .verifyComplete();
    }

    @Test
    @DisplayName("should treat an unavailable authority as a denial")
    void fallbackDenies() {
        WebClientResourceAuthorityClient client = new WebClientResourceAuthorityClient(new HorizonProperties());

        StepVerifier.create(client.allocateForAdaptationFallback(PROPOSAL, new IllegalStateException("open circuit")))
                .assertNext(result -> {
                    assertThat(result.granted()).isFalse();
                    assertThat(result.reason()).isEqualTo("resource authority unavailable");
                })
                .verifyComplete();
    }
}
