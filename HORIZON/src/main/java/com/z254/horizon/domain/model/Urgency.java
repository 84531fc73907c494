package com.z254.horizon.domain.model;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
