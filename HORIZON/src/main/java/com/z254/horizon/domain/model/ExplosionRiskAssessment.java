package com.z254.horizon.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time explosion risk view over the current variety history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplosionRiskAssessment {

    private double currentRisk;
    private VarietyTrend trend;

    /** Seconds until critical variety; positive infinity when not rising */
    private double timeToExplosionSeconds;

    private double cascadeProbability;

    @Builder.Default
    private List<MitigationOption> mitigationOptions = new ArrayList<>();

    @JsonIgnore
    public boolean isExplosionImminent() {
        return Double.isFinite(timeToExplosionSeconds);
    }
}
