package com.z254.horizon.client;

import com.z254.horizon.domain.model.AdaptationProposal;
import com.z254.horizon.domain.model.CascadePrediction;
import com.z254.horizon.domain.model.EvolutionType;
import com.z254.horizon.domain.model.Urgency;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Client interface for the policy authority.
 * The authority approves or vetoes adaptations and owns decisions beyond this
 * layer's scope, such as spawning new control capacity.
 */
public interface PolicyAuthorityClient {

    /**
     * Submit an adaptation proposal for approval.
     *
     * @param proposal the proposal
     * @return the authority's decision
     */
    Mono<AdaptationDecision> approveAdaptation(AdaptationProposal proposal);

    /**
     * Request an emergency meta-system to absorb variety.
     */
    Mono<Void> spawnMetaSystemEmergency(MetaSystemSpawnRequest request);

    /**
     * Report a predicted cascade that is unlikely to be contained.
     */
    Mono<Void> handleCascadeRisk(CascadeRiskReport report);

    /**
     * Report an unusual burst of emergent patterns or meta-patterns.
     */
    Mono<Void> handlePatternEmergence(PatternEmergenceNotice notice);

    /**
     * Propose a structural evolution of the control system.
     */
    Mono<Void> proposeSystemEvolution(SystemEvolutionProposal proposal);

    // Request/Response DTOs

    record AdaptationDecision(
            String proposalId,
            boolean approved,
            String reason,
            Instant decidedAt
    ) {}

    record MetaSystemSpawnRequest(
            String reason,
            double varietyLevel,
            double varietyRatio,
            double explosionRisk,
            Urgency urgency,
            String metaSystemType,
            Instant requestedAt
    ) {
        public static final String VARIETY_EXPLOSION = "variety_explosion";
        public static final String VARIETY_ABSORBER = "variety_absorber";
    }

    record CascadeRiskReport(
            CascadePrediction prediction,
            Urgency urgency,
            String recommendedAction
    ) {
        public static final String PREEMPTIVE_META_SPAWN = "preemptive_meta_spawn";
    }

    record PatternEmergenceNotice(
            int emergentPatterns,
            int metaPatterns,
            double emergenceScore,
            List<String> patternIds,
            Instant detectedAt
    ) {}

    record SystemEvolutionProposal(
            EvolutionType evolutionType,
            Urgency urgency,
            int hierarchyDepth,
            int recursiveStructures,
            double selfSimilarityIndex,
            double universalityIndex,
            Instant proposedAt
    ) {}
}
