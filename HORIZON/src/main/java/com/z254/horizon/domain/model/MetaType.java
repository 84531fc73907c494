package com.z254.horizon.domain.model;

/**
 * Kind of meta-pattern, derived from the component pattern types.
 */
public enum MetaType {
    TEMPORAL_HIERARCHY,
    SPATIAL_HIERARCHY,
    BEHAVIORAL_COMPOSITION,
    CROSS_DOMAIN;

    /**
     * Derive the meta type for a pair of pattern types.
     */
    public static MetaType forPair(PatternType first, PatternType second) {
        if (first != second) {
            return CROSS_DOMAIN;
        }
        return switch (first) {
            case TEMPORAL -> TEMPORAL_HIERARCHY;
            case SPATIAL -> SPATIAL_HIERARCHY;
            case BEHAVIORAL -> BEHAVIORAL_COMPOSITION;
            default -> CROSS_DOMAIN;
        };
    }
}
