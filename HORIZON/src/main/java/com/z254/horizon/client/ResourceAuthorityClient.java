package com.z254.horizon.client;

import com.z254.horizon.domain.model.AdaptationProposal;
import com.z254.horizon.domain.model.RiskReport;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Client interface for the resource authority.
 */
public interface ResourceAuthorityClient {

    /**
     * Request capacity for an adaptation. A denial is a normal result.
     */
    Mono<AllocationResult> allocateForAdaptation(AdaptationProposal proposal);

    /**
     * Spread an explosion's variety load across available capacity.
     */
    Mono<Void> redistributeVariety(VarietyRedistributionRequest request);

    /**
     * Immutable view of the explosion reading sent for redistribution.
     */
    record VarietyRedistributionRequest(double externalVariety,
                                        double internalCapacity,
                                        double varietyRatio,
                                        double explosionRisk,
                                        Instant timestamp) {

        public static VarietyRedistributionRequest of(RiskReport report) {
            return new VarietyRedistributionRequest(report.getExternalVariety(), report.getInternalCapacity(),
                    report.getVarietyRatio(), report.getExplosionRisk(), report.getTimestamp());
        }
    }

    record AllocationResult(boolean granted, String reason) {

        public static AllocationResult grant() {
            return new AllocationResult(true, null);
        }

        public static AllocationResult denied(String reason) {
            return new AllocationResult(false, reason);
        }
    }
}
