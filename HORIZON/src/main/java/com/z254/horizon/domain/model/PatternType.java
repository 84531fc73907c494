package com.z254.horizon.domain.model;

/**
 * Classification of a detected pattern.
 */
public enum PatternType {
    BEHAVIORAL,
    STRUCTURAL,
    TEMPORAL,
    SPATIAL,
    QUANTUM,
    META
}
