package com.z254.horizon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one detection cycle: the patterns accepted as emergent and the
 * meta-patterns they formed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResult {

    @Builder.Default
    private List<Pattern> patterns = new ArrayList<>();

    @Builder.Default
    private List<MetaPattern> metaPatterns = new ArrayList<>();

    /** Mean emergence score of the accepted patterns, 0 when none */
    private double emergenceScore;

    private double graphComplexity;

    public static DetectionResult empty(double graphComplexity) {
        return DetectionResult.builder().graphComplexity(graphComplexity).build();
    }
}
