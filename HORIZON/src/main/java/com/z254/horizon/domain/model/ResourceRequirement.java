package com.z254.horizon.domain.model;

public record ResourceRequirement(String duration, SignalLevel intensity) {
}
