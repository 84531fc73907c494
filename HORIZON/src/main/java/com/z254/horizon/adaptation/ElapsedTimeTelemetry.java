package com.z254.horizon.adaptation;

import com.z254.horizon.domain.model.Adaptation;
import org.springframework.stereotype.Component;

/**
 * Default telemetry: trusts elapsed time. A resource-constrained adaptation is
 * only confirmed once its full expected duration has elapsed.
 */
@Component
public class ElapsedTimeTelemetry implements AdaptationTelemetry {

    @Override
    public Verdict assessCompletion(Adaptation adaptation, double progress) {
        if (adaptation.isResourceConstrained() && progress < 1.0) {
            return Verdict.PENDING;
        }
        return Verdict.CONFIRMED;
    }
}
