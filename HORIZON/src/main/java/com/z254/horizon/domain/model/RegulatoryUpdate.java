package com.z254.horizon.domain.model;

public record RegulatoryUpdate(String regulation, String status, SignalLevel impact) {
}
