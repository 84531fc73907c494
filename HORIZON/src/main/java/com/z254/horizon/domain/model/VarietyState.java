package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Snapshot of the variety monitor. The ratio is derived from the level and
 * capacity captured together.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VarietyState {

    private double currentVarietyLevel;
    private double internalVarietyCapacity;
    private double varietyRatio;
    private double absorptionRate;
    private int explosionEventCount;
    private int cascadePredictionCount;
    private VarietyMetrics metrics;

    @Builder.Default
    private Set<ProtocolAction> activeMeasures = EnumSet.noneOf(ProtocolAction.class);

    private boolean monitoringActive;
    private Instant lastAssessedAt;
}
