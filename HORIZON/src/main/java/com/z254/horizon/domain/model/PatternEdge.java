package com.z254.horizon.domain.model;

/**
 * Weighted link between two correlated patterns.
 */
public record PatternEdge(String source, String target, double weight) {
}
