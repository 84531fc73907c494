package com.z254.horizon.domain.model;

public enum SystemImpact {
    MODERATE,
    SEVERE,
    CRITICAL,
    CATASTROPHIC
}
