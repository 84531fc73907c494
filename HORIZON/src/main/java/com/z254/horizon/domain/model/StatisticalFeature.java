package com.z254.horizon.domain.model;

/**
 * Moments of a segment. Kurtosis is excess kurtosis.
 */
public record StatisticalFeature(double mean, double variance, double skewness, double kurtosis)
        implements Feature {

    @Override
    public FeatureType featureType() {
        return FeatureType.STATISTICAL;
    }

    @Override
    public double strength() {
        double magnitude = Math.abs(mean);
        double deviation = Math.sqrt(variance);
        if (magnitude + deviation == 0.0) {
            return 0.0;
        }
        return magnitude / (magnitude + deviation);
    }

    @Override
    public double[] vector() {
        return new double[]{mean, variance, Math.tanh(skewness), Math.tanh(kurtosis)};
    }
}
