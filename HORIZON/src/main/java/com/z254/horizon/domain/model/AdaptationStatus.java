package com.z254.horizon.domain.model;

public enum AdaptationStatus {
    IN_PROGRESS,
    COMPLETED
}
