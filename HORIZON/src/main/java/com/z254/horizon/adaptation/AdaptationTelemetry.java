package com.z254.horizon.adaptation;

import com.z254.horizon.domain.model.Adaptation;

/**
 * Source of truth on whether an adaptation that has reached its completion
 * threshold actually took effect.
 */
public interface AdaptationTelemetry {

    Verdict assessCompletion(Adaptation adaptation, double progress);

    enum Verdict {
        /** The adaptation took effect */
        CONFIRMED,
        /** Not yet observable; keep monitoring */
        PENDING,
        /** The adaptation ran its course without effect */
        FAILED
    }
}
