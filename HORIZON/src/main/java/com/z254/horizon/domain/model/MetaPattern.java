package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Higher-order pattern formed by two correlated patterns.
 * Strength is the average of the component strengths scaled by 0.9.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetaPattern {

    public static final double STRENGTH_FACTOR = 0.9;

    private String id;
    private List<String> componentPatternIds;
    private MetaType metaType;
    private double strength;
    private Instant timestamp;
}
