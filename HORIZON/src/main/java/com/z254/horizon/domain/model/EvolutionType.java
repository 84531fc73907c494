package com.z254.horizon.domain.model;

/**
 * Structural evolution suggested by a meta-pattern scan.
 */
public enum EvolutionType {
    RECURSIVE_EXPANSION,
    HIERARCHICAL_RESTRUCTURING,
    FRACTAL_EVOLUTION,
    UNIVERSAL_INTEGRATION,
    ADAPTIVE_EVOLUTION
}
