package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One sample in the evolution history of a stored pattern.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternObservation {

    private String patternId;
    private PatternType patternType;
    private double strength;
    private Instant timestamp;

    public static PatternObservation of(Pattern pattern) {
        return new PatternObservation(pattern.getId(), pattern.getPatternType(),
                pattern.getStrength(), pattern.getTimestamp());
    }
}
