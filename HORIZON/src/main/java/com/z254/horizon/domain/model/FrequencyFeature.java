package com.z254.horizon.domain.model;

/**
 * Spectral summary of a segment. Dominant frequency is in cycles per sample.
 */
public record FrequencyFeature(double dominantFrequency, double spectralEntropy) implements Feature {

    @Override
    public FeatureType featureType() {
        return FeatureType.FREQUENCY;
    }

    @Override
    public double strength() {
        return Math.max(0.0, Math.min(1.0, 1.0 - spectralEntropy));
    }

    @Override
    public double[] vector() {
        return new double[]{dominantFrequency, spectralEntropy};
    }
}
