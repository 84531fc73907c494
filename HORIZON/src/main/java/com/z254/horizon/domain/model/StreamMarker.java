package com.z254.horizon.domain.model;

/**
 * Markers attached to a data stream that steer pattern classification.
 */
public enum StreamMarker {
    SPATIAL_DISTRIBUTION,
    BEHAVIORAL_SIGNATURE
}
