package com.z254.horizon.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/**
 * A pattern detected in one detection cycle.
 * <p>
 * Patterns are not changed after creation; derive a new one with
 * {@link #toBuilder()}. Re-detections are tracked as
 * {@link PatternObservation}s.
 */
@Value
@Builder(toBuilder = true)
public class Pattern {

    private String id;

    @Singular
    private List<Feature> features;

    private PatternType patternType;

    /** Strength in [0,1] */
    private double strength;

    /** Emergence score in [0,1] */
    private double emergenceScore;

    @Builder.Default
    private double scale = 1.0;

    private Instant timestamp;

    /**
     * Mean regularity of the structural features, if any.
     */
    public OptionalDouble structuralRegularity() {
        return features.stream()
                .filter(StructuralFeature.class::isInstance)
                .map(StructuralFeature.class::cast)
                .mapToDouble(StructuralFeature::regularity)
                .average();
    }
}
