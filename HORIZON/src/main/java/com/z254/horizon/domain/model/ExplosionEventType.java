package com.z254.horizon.domain.model;

public enum ExplosionEventType {
    UNCONTROLLED_EXPLOSION,
    EMERGENCY_RESPONSE
}
