package com.z254.horizon.domain.model;

public enum ProtocolName {
    META_SPAWN,
    CASCADE_PREVENTION,
    EMERGENCY_FILTER,
    CONTROLLED_DEGRADATION
}
