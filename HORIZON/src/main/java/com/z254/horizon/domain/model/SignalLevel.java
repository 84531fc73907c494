package com.z254.horizon.domain.model;

/**
 * Qualitative level reported by a signal source, with its numeric magnitude.
 */
public enum SignalLevel {
    LOW(0.3),
    MEDIUM(0.6),
    HIGH(0.9);

    private final double magnitude;

    SignalLevel(double magnitude) {
        this.magnitude = magnitude;
    }

    public double getMagnitude() {
        return magnitude;
    }
}
