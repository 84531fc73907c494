package com.z254.horizon.domain.model;

public record MarketSignal(String signal, double strength, String source) {
}
