package com.z254.horizon.domain.model;

import com.z254.horizon.domain.exception.SignalValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Variety indicators reported alongside a signal snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VarietyData {

    @Builder.Default
    private Map<String, Object> novelPatterns = new HashMap<>();

    @Builder.Default
    private List<String> emergentProperties = new ArrayList<>();

    @Builder.Default
    private List<String> recursivePotential = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metaSystemSeeds = new HashMap<>();

    private boolean quantumSuperposition;

    /**
     * Reject payloads with missing collections.
     *
     * @throws SignalValidationException naming the first missing field
     */
    public void validate() {
        if (novelPatterns == null) {
            throw SignalValidationException.missing("novelPatterns");
        }
        if (emergentProperties == null) {
            throw SignalValidationException.missing("emergentProperties");
        }
        if (recursivePotential == null) {
            throw SignalValidationException.missing("recursivePotential");
        }
        if (metaSystemSeeds == null) {
            throw SignalValidationException.missing("metaSystemSeeds");
        }
    }
}
