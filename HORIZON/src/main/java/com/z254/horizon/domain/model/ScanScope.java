package com.z254.horizon.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Coverage of a scan. Each scope names the signal families it collects.
 */
public enum ScanScope {
    FULL(1.0, EnumSet.allOf(SignalFamily.class)),
    PARTIAL(0.6, EnumSet.of(SignalFamily.MARKET, SignalFamily.TECHNOLOGY)),
    TARGETED(0.3, EnumSet.of(SignalFamily.MARKET));

    private final double coverage;
    private final Set<SignalFamily> families;

    ScanScope(double coverage, Set<SignalFamily> families) {
        this.coverage = coverage;
        this.families = families;
    }

    public double getCoverage() {
        return coverage;
    }

    public Set<SignalFamily> getFamilies() {
        return EnumSet.copyOf(families);
    }
}
