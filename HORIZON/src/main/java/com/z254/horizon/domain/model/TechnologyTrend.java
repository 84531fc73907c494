package com.z254.horizon.domain.model;

public record TechnologyTrend(String trend, SignalLevel impact, String timeline) {
}
