package com.z254.horizon.variety;

import java.time.Instant;

/**
 * One external variety reading.
 */
public record VarietySample(Instant timestamp, double variety) {
}
