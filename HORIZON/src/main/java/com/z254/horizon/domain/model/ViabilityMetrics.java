package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate viability readings used to derive adaptation challenges.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViabilityMetrics {

    @Builder.Default
    private double health = 1.0;

    @Builder.Default
    private double efficiency = 1.0;

    @Builder.Default
    private double innovationLag = 0.0;
}
