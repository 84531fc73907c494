package com.z254.horizon.observability;

import com.z254.horizon.domain.model.ProtocolName;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for HORIZON service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Environmental scans (completed, source unavailable, latency)</li>
 *     <li>Pattern detection (detected, emergent, meta-patterns, emergence scores)</li>
 *     <li>Variety monitoring (risk, ratio, explosions, protocols, cascades)</li>
 *     <li>Adaptations (proposed, started, completed, duration)</li>
 * </ul>
 */
@Component
public class HorizonMetrics {

    private final MeterRegistry meterRegistry;

    // Scan metrics
    @Getter
    private final Counter scansCompleted;
    @Getter
    private final Counter scansSourceUnavailable;
    private final Timer scanLatency;

    // Pattern metrics
    @Getter
    private final Counter patternsDetected;
    @Getter
    private final Counter emergentPatterns;
    @Getter
    private final Counter metaPatternsFormed;
    private final Timer detectionLatency;
    private final DistributionSummary emergenceScore;
    private final AtomicInteger storedPatterns;

    // Variety metrics
    @Getter
    private final Counter varietyAssessments;
    @Getter
    private final Counter explosions;
    @Getter
    private final Counter protocolActionFailures;
    @Getter
    private final Counter cascadePredictions;
    @Getter
    private final Counter cascadeRiskEscalations;
    private final DistributionSummary explosionRisk;
    private final AtomicReference<Double> varietyRatio;
    private final AtomicReference<Double> internalCapacity;
    private final Map<ProtocolName, Counter> protocolsByName = new ConcurrentHashMap<>();

    // Adaptation metrics
    @Getter
    private final Counter proposalsGenerated;
    @Getter
    private final Counter adaptationsStarted;
    @Getter
    private final Counter adaptationsCompleted;
    @Getter
    private final Counter adaptationsResourceConstrained;
    @Getter
    private final Counter progressFaults;
    private final Timer adaptationDuration;
    private final AtomicInteger activeAdaptations;

    public HorizonMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize scan metrics
        this.scansCompleted = Counter.builder("horizon.scans.completed")
                .description("Environmental scans completed")
                .register(meterRegistry);
        this.scansSourceUnavailable = Counter.builder("horizon.scans.source_unavailable")
                .description("Scans that returned an empty snapshot because the source was unavailable")
                .register(meterRegistry);
        this.scanLatency = Timer.builder("horizon.scans.latency")
                .description("Environmental scan latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        // Initialize pattern metrics
        this.patternsDetected = Counter.builder("horizon.patterns.detected")
                .description("Candidate patterns instantiated")
                .register(meterRegistry);
        this.emergentPatterns = Counter.builder("horizon.patterns.emergent")
                .description("Patterns accepted as emergent")
                .register(meterRegistry);
        this.metaPatternsFormed = Counter.builder("horizon.patterns.meta")
                .description("Meta-patterns formed")
                .register(meterRegistry);
        this.detectionLatency = Timer.builder("horizon.patterns.detection.latency")
                .description("Pattern detection cycle latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.emergenceScore = DistributionSummary.builder("horizon.patterns.emergence_score")
                .description("Emergence scores of detected patterns")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.storedPatterns = meterRegistry.gauge("horizon.patterns.stored", new AtomicInteger(0));

        // Initialize variety metrics
        this.varietyAssessments = Counter.builder("horizon.variety.assessments")
                .description("Variety monitoring requests")
                .register(meterRegistry);
        this.explosions = Counter.builder("horizon.variety.explosions")
                .description("Uncontrolled variety explosions")
                .register(meterRegistry);
        this.protocolActionFailures = Counter.builder("horizon.variety.protocol.action_failures")
                .description("Emergency protocol actions that failed")
                .register(meterRegistry);
        this.cascadePredictions = Counter.builder("horizon.variety.cascade.predictions")
                .description("Cascade predictions computed")
                .register(meterRegistry);
        this.cascadeRiskEscalations = Counter.builder("horizon.variety.cascade.escalations")
                .description("Cascade risks escalated to the policy authority")
                .register(meterRegistry);
        this.explosionRisk = DistributionSummary.builder("horizon.variety.risk")
                .description("Explosion risk scores")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.varietyRatio = new AtomicReference<>(0.0);
        Gauge.builder("horizon.variety.ratio", varietyRatio, AtomicReference::get)
                .description("Current variety ratio")
                .register(meterRegistry);
        this.internalCapacity = new AtomicReference<>(0.0);
        Gauge.builder("horizon.variety.capacity", internalCapacity, AtomicReference::get)
                .description("Internal variety capacity")
                .register(meterRegistry);

        // Initialize adaptation metrics
        this.proposalsGenerated = Counter.builder("horizon.adaptations.proposed")
                .description("Adaptation proposals generated")
                .register(meterRegistry);
        this.adaptationsStarted = Counter.builder("horizon.adaptations.started")
                .description("Adaptations started")
                .register(meterRegistry);
        this.adaptationsCompleted = Counter.builder("horizon.adaptations.completed")
                .description("Adaptations completed")
                .register(meterRegistry);
        this.adaptationsResourceConstrained = Counter.builder("horizon.adaptations.resource_constrained")
                .description("Adaptations running without a resource allocation")
                .register(meterRegistry);
        this.progressFaults = Counter.builder("horizon.adaptations.progress_faults")
                .description("Progress checks that failed and were recovered")
                .register(meterRegistry);
        this.adaptationDuration = Timer.builder("horizon.adaptations.duration")
                .description("Adaptation start to completion")
                .register(meterRegistry);
        this.activeAdaptations = meterRegistry.gauge("horizon.adaptations.active", new AtomicInteger(0));
    }

    // ========== Scan Methods ==========

    public Timer.Sample startScanTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordScanCompleted(Timer.Sample sample, boolean sourceAvailable) {
        sample.stop(scanLatency);
        scansCompleted.increment();
        if (!sourceAvailable) {
            scansSourceUnavailable.increment();
        }
    }

    // ========== Pattern Methods ==========

    public Timer.Sample startDetectionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordDetection(Timer.Sample sample, int candidates, int emergent, int metaPatterns,
                                double score, int stored) {
        sample.stop(detectionLatency);
        patternsDetected.increment(candidates);
        emergentPatterns.increment(emergent);
        metaPatternsFormed.increment(metaPatterns);
        emergenceScore.record(score);
        storedPatterns.set(stored);
    }

    // ========== Variety Methods ==========

    public void recordAssessment(double risk, double ratio, double capacity) {
        varietyAssessments.increment();
        explosionRisk.record(risk);
        varietyRatio.set(ratio);
        internalCapacity.set(capacity);
    }

    public void recordCapacity(double ratio, double capacity) {
        varietyRatio.set(ratio);
        internalCapacity.set(capacity);
    }

    public void recordExplosion() {
        explosions.increment();
    }

    public void recordProtocolExecuted(ProtocolName protocol, int failedActions) {
        getProtocolCounter(protocol).increment();
        protocolActionFailures.increment(failedActions);
    }

    public void recordCascadePrediction(boolean escalated) {
        cascadePredictions.increment();
        if (escalated) {
            cascadeRiskEscalations.increment();
        }
    }

    private Counter getProtocolCounter(ProtocolName protocol) {
        return protocolsByName.computeIfAbsent(protocol, name ->
                Counter.builder("horizon.variety.protocols.executed")
                        .tag("protocol", name.name().toLowerCase())
                        .description("Emergency protocols executed by name")
                        .register(meterRegistry));
    }

    // ========== Adaptation Methods ==========

    public void recordProposalGenerated() {
        proposalsGenerated.increment();
    }

    public void recordAdaptationStarted() {
        adaptationsStarted.increment();
        activeAdaptations.incrementAndGet();
    }

    public void recordAdaptationCompleted(Duration duration) {
        adaptationsCompleted.increment();
        activeAdaptations.decrementAndGet();
        adaptationDuration.record(duration);
    }

    public void recordResourceConstrained() {
        adaptationsResourceConstrained.increment();
    }

    public void recordProgressFault() {
        progressFaults.increment();
    }
}
