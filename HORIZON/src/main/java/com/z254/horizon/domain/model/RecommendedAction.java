package com.z254.horizon.domain.model;

/**
 * Action recommended by a variety risk assessment.
 */
public enum RecommendedAction {
    IMMEDIATE_META_SYSTEM_SPAWN,
    EMERGENCY_ABSORPTION,
    INCREASE_INTERNAL_VARIETY,
    SELECTIVE_FILTERING,
    MONITOR;

    /**
     * Boundary table over risk first, then ratio.
     */
    public static RecommendedAction forRisk(double risk, double ratio) {
        if (risk > 0.9) {
            return IMMEDIATE_META_SYSTEM_SPAWN;
        } else if (risk > 0.7) {
            return EMERGENCY_ABSORPTION;
        } else if (ratio > 2.0) {
            return INCREASE_INTERNAL_VARIETY;
        } else if (ratio > 1.5) {
            return SELECTIVE_FILTERING;
        }
        return MONITOR;
    }
}
