package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate adaptation performance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AdaptationMetrics {

    private double successRate;

    /** Mean seconds from start to completion */
    private double averageCompletionTime;

    private double resourceEfficiency;
    private double innovationIndex;
    private int activeAdaptations;
    private double adaptationCapacity;
    private long completedAdaptations;

    public static AdaptationMetrics initial() {
        return AdaptationMetrics.builder()
                .successRate(0.9)
                .averageCompletionTime(0.0)
                .resourceEfficiency(0.85)
                .innovationIndex(0.7)
                .activeAdaptations(0)
                .adaptationCapacity(0.9)
                .completedAdaptations(0)
                .build();
    }

    /**
     * Capacity for new work drops stepwise with the active count.
     */
    public static double capacityFor(int activeCount) {
        if (activeCount >= 5) {
            return 0.2;
        } else if (activeCount >= 3) {
            return 0.5;
        }
        return 0.9;
    }
}
