package com.z254.horizon.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.z254.horizon.domain.exception.SignalValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured snapshot of environmental signals produced by one scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalSnapshot {

    @Builder.Default
    private List<MarketSignal> marketSignals = new ArrayList<>();

    @Builder.Default
    private List<TechnologyTrend> technologyTrends = new ArrayList<>();

    @Builder.Default
    private List<RegulatoryUpdate> regulatoryUpdates = new ArrayList<>();

    @Builder.Default
    private List<CompetitiveMove> competitiveMoves = new ArrayList<>();

    /** Optional variety indicators */
    private VarietyData llmVariety;

    private ScanScope scope;

    @Builder.Default
    private double coverage = 1.0;

    @Builder.Default
    private boolean sourceAvailable = true;

    private Instant timestamp;

    /**
     * Snapshot recorded when the signal source could not be reached.
     */
    public static SignalSnapshot unavailable(ScanScope scope, Instant timestamp) {
        return SignalSnapshot.builder()
                .scope(scope)
                .coverage(scope.getCoverage())
                .sourceAvailable(false)
                .timestamp(timestamp)
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return marketSignals.isEmpty() && technologyTrends.isEmpty()
                && regulatoryUpdates.isEmpty() && competitiveMoves.isEmpty();
    }

    /**
     * @throws SignalValidationException if a signal family is missing or coverage is out of range
     */
    public void validate() {
        if (marketSignals == null) {
            throw SignalValidationException.missing("marketSignals");
        }
        if (technologyTrends == null) {
            throw SignalValidationException.missing("technologyTrends");
        }
        if (regulatoryUpdates == null) {
            throw SignalValidationException.missing("regulatoryUpdates");
        }
        if (competitiveMoves == null) {
            throw SignalValidationException.missing("competitiveMoves");
        }
        if (coverage < 0.0 || coverage > 1.0) {
            throw new SignalValidationException("coverage", "Coverage out of range: " + coverage);
        }
        if (llmVariety != null) {
            llmVariety.validate();
        }
    }
}
