package com.z254.horizon.domain.model;

public enum FeatureType {
    STATISTICAL,
    FREQUENCY,
    STRUCTURAL
}
