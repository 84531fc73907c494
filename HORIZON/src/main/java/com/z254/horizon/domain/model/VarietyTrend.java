package com.z254.horizon.domain.model;

/**
 * Direction of recent variety levels.
 */
public enum VarietyTrend {
    INCREASING(1.2, 2.5),
    STABLE(1.0, 1.8),
    DECREASING(0.8, 1.3);

    private final double riskFactor;
    private final double peakMultiplier;

    VarietyTrend(double riskFactor, double peakMultiplier) {
        this.riskFactor = riskFactor;
        this.peakMultiplier = peakMultiplier;
    }

    public double getRiskFactor() {
        return riskFactor;
    }

    /** Multiplier applied to the initial variety to estimate a cascade peak. */
    public double getPeakMultiplier() {
        return peakMultiplier;
    }
}
