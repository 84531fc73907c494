package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stage-wise simulation of how unmanaged variety would propagate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CascadePrediction {

    private double initialVariety;

    @Builder.Default
    private List<CascadeStage> cascadeStages = new ArrayList<>();

    /** Escalation order */
    @Builder.Default
    private List<AffectedSystem> affectedSystems = new ArrayList<>();

    private double peakVariety;
    private double containmentProbability;
    private Duration estimatedDuration;
    private Instant timestamp;
}
