package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VarietyMetrics {

    private double peakVariety;
    private double averageVariety;
    private long samples;
    private long explosionCount;
    private long cascadeEvents;

    /** Seconds from the last uncontrolled explosion to the next absorbed reading */
    private double recoveryTime;

    public static VarietyMetrics initial() {
        return new VarietyMetrics(0.0, 0.0, 0L, 0L, 0L, 0.0);
    }
}
