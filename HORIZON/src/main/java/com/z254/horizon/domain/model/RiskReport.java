package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of one variety monitoring request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskReport {

    private double externalVariety;
    private double internalCapacity;

    /** externalVariety / internalCapacity at the moment of computation */
    private double varietyRatio;

    /** Normalized risk in [0,1] */
    private double explosionRisk;

    private RecommendedAction recommendedAction;
    private double absorptionCapability;
    private VarietyTrend trend;

    /** Present when the explosion threshold was exceeded */
    private AbsorptionOutcome absorptionOutcome;

    /** Present when an emergency protocol ran */
    private ProtocolResult protocolResult;

    private Instant timestamp;
}
