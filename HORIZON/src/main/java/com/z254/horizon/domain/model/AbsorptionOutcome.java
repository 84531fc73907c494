package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of executing an absorption strategy.
 * Exceeded capacity is a normal outcome that triggers escalation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbsorptionOutcome {

    private AbsorptionStrategy strategy;
    private double varietyToAbsorb;
    private double absorptionCapability;
    private boolean capacityExceeded;
    private double absorbed;

    public static AbsorptionOutcome absorbed(AbsorptionStrategy strategy, double variety, double capability) {
        return new AbsorptionOutcome(strategy, variety, capability, false,
                variety * strategy.getAbsorptionFraction());
    }

    public static AbsorptionOutcome capacityExceeded(AbsorptionStrategy strategy, double variety, double capability) {
        return new AbsorptionOutcome(strategy, variety, capability, true, 0.0);
    }
}
