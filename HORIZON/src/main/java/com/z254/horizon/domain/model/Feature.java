package com.z254.horizon.domain.model;

/**
 * A typed feature extracted from one segment of a data stream.
 */
public interface Feature {

    FeatureType featureType();

    /**
     * Strength of the structure this feature describes, in [0,1].
     */
    double strength();

    /**
     * Bounded numeric representation used for distance computations.
     */
    double[] vector();
}
