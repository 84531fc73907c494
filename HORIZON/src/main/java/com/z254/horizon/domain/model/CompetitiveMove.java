package com.z254.horizon.domain.model;

public record CompetitiveMove(String competitor, String action, SignalLevel threatLevel) {
}
