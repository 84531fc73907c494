package com.z254.horizon.variety;

import com.z254.horizon.domain.model.AffectedSystem;
import com.z254.horizon.domain.model.CascadePrediction;
import com.z254.horizon.domain.model.CascadeStage;
import com.z254.horizon.domain.model.SystemImpact;
import com.z254.horizon.domain.model.VarietyTrend;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Simulates how variety above capacity amplifies through four stages.
 * Each stage is entered only while the amplified variety still exceeds its
 * multiple of capacity.
 */
@Component
public class CascadePredictor {

    public CascadePrediction predict(double variety, double capacity, VarietyTrend trend,
                                     double absorptionCapability, Instant now) {
        return CascadePrediction.builder()
                .initialVariety(variety)
                .cascadeStages(stages(variety, capacity))
                .affectedSystems(affectedSystems(variety, capacity))
                .peakVariety(variety * trend.getPeakMultiplier())
                .containmentProbability(containment(variety, absorptionCapability))
                .estimatedDuration(Duration.ofMillis(Math.round(1000.0 * variety)))
                .timestamp(now)
                .build();
    }

    public double containment(double variety, double absorptionCapability) {
        if (absorptionCapability >= variety) {
            return 0.9;
        }
        double coverage = absorptionCapability / variety;
        return Math.max(0.1, coverage * coverage);
    }

    // ========== Private Helper Methods ==========

    private List<CascadeStage> stages(double initial, double capacity) {
        List<CascadeStage> stages = new ArrayList<>();
        double current = initial;

        if (current > capacity) {
            stages.add(new CascadeStage(1, "Initial variety overload", current,
                    SystemImpact.MODERATE, Duration.ofMillis(100)));
            current *= 1.2;
        }
        if (current > capacity * 1.5) {
            stages.add(new CascadeStage(2, "System stress and degradation", current,
                    SystemImpact.SEVERE, Duration.ofMillis(500)));
            current *= 1.3;
        }
        if (current > capacity * 2.0) {
            stages.add(new CascadeStage(3, "Cascade propagation to subsystems", current,
                    SystemImpact.CRITICAL, Duration.ofMillis(1000)));
            current *= 1.5;
        }
        if (current > capacity * 3.0) {
            stages.add(new CascadeStage(4, "System collapse risk", current,
                    SystemImpact.CATASTROPHIC, null));
        }
        return stages;
    }

    private List<AffectedSystem> affectedSystems(double variety, double capacity) {
        List<AffectedSystem> affected = new ArrayList<>();
        for (AffectedSystem system : AffectedSystem.values()) {
            if (variety > system.getCapacityMultiple() * capacity) {
                affected.add(system);
            }
        }
        return affected;
    }
}
