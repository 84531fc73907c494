package com.z254.horizon.domain.model;

public enum ModelType {
    INCREMENTAL,
    TRANSFORMATIONAL,
    DEFENSIVE
}
