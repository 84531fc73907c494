package com.z254.horizon.domain.model;

public record StructuralFeature(double complexity, double regularity) implements Feature {

    @Override
    public FeatureType featureType() {
        return FeatureType.STRUCTURAL;
    }

    @Override
    public double strength() {
        return regularity;
    }

    @Override
    public double[] vector() {
        return new double[]{complexity, regularity};
    }
}
