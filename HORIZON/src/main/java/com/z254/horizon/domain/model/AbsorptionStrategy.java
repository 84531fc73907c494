package com.z254.horizon.domain.model;

/**
 * How much incoming variety is accepted versus filtered.
 */
public enum AbsorptionStrategy {
    EMERGENCY(1.0),
    SELECTIVE(0.7),
    GRADUAL(0.5),
    NORMAL(0.3);

    private final double absorptionFraction;

    AbsorptionStrategy(double absorptionFraction) {
        this.absorptionFraction = absorptionFraction;
    }

    public double getAbsorptionFraction() {
        return absorptionFraction;
    }

    /**
     * Step function over the variety ratio.
     */
    public static AbsorptionStrategy forRatio(double ratio) {
        if (ratio > 3.0) {
            return EMERGENCY;
        } else if (ratio > 2.0) {
            return SELECTIVE;
        } else if (ratio > 1.5) {
            return GRADUAL;
        }
        return NORMAL;
    }
}
