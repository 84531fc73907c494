package com.z254.horizon.domain.model;

/**
 * Reach of a challenge. The weight scales estimated adaptation impact.
 */
public enum Scope {
    OPERATIONAL(0.25),
    TACTICAL(0.5),
    STRATEGIC(0.75),
    SYSTEM_WIDE(1.0);

    private final double weight;

    Scope(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }
}
