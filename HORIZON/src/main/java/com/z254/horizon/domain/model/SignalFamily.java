package com.z254.horizon.domain.model;

public enum SignalFamily {
    MARKET,
    TECHNOLOGY,
    REGULATORY,
    COMPETITIVE
}
