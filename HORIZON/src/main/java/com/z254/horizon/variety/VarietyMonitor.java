package com.z254.horizon.variety;

import com.z254.horizon.adaptation.AdaptationEngine;
import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.PolicyAuthorityClient.CascadeRiskReport;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.exception.SignalValidationException;
import com.z254.horizon.domain.model.AbsorptionOutcome;
import com.z254.horizon.domain.model.AbsorptionStrategy;
import com.z254.horizon.domain.model.CascadePrediction;
import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ChallengeType;
import com.z254.horizon.domain.model.ExplosionEvent;
import com.z254.horizon.domain.model.ExplosionEventType;
import com.z254.horizon.domain.model.ExplosionRiskAssessment;
import com.z254.horizon.domain.model.ProtocolAction;
import com.z254.horizon.domain.model.ProtocolResult;
import com.z254.horizon.domain.model.RecommendedAction;
import com.z254.horizon.domain.model.RiskReport;
import com.z254.horizon.domain.model.Scope;
import com.z254.horizon.domain.model.Urgency;
import com.z254.horizon.domain.model.VarietyData;
import com.z254.horizon.domain.model.VarietyMetrics;
import com.z254.horizon.domain.model.VarietyState;
import com.z254.horizon.domain.model.VarietyTrend;
import com.z254.horizon.kafka.IntelligenceEventProducer;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.observability.HorizonStructuredLogger.VarietyEventType;
import com.z254.horizon.runtime.ComponentMailbox;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Variety explosion monitoring component.
 * <p>
 * Compares external variety against a self-adapting internal capacity, scores
 * explosion risk and, above the explosion threshold, absorbs or escalates
 * inside the same request so the returned report already reflects the
 * remediation taken.
 * <p>
 * A reading at or above the lowest protocol threshold raises one variety
 * challenge with the adaptation engine until risk falls back below it, at
 * which point the active protective measures are released.
 * <p>
 * A periodic assessment predicts cascades at critical ratios and adapts the
 * internal capacity within its configured bounds.
 */
@Slf4j
@Service
public class VarietyMonitor {

    private final ExplosionRiskModel riskModel;
    private final CascadePredictor cascadePredictor;
    private final EmergencyProtocolExecutor protocolExecutor;
    private final PolicyAuthorityClient policyAuthority;
    private final AdaptationEngine adaptationEngine;
    private final IntelligenceEventProducer eventProducer;
    private final HorizonMetrics metrics;
    private final HorizonStructuredLogger structuredLogger;
    private final HorizonProperties.Variety config;
    private final Clock clock;
    private final ComponentMailbox mailbox;

    // Mailbox-confined state
    private double currentVarietyLevel;
    private double internalCapacity;
    private double absorptionRate;
    private final Deque<VarietySample> history = new ArrayDeque<>();
    private final Deque<ExplosionEvent> explosionEvents = new ArrayDeque<>();
    private final Deque<CascadePrediction> cascadePredictions = new ArrayDeque<>();
    private final Set<ProtocolAction> activeMeasures = EnumSet.noneOf(ProtocolAction.class);
    private VarietyMetrics varietyMetrics = VarietyMetrics.initial();
    private boolean explosionSinceLastAssessment;
    private boolean varietyChallengeOpen;
    private Instant lastExplosionAt;
    private Instant lastAssessedAt;
    private boolean monitoringActive;

    public VarietyMonitor(ExplosionRiskModel riskModel,
                          CascadePredictor cascadePredictor,
                          EmergencyProtocolExecutor protocolExecutor,
                          PolicyAuthorityClient policyAuthority,
                          AdaptationEngine adaptationEngine,
                          IntelligenceEventProducer eventProducer,
                          HorizonMetrics metrics,
                          HorizonStructuredLogger structuredLogger,
                          HorizonProperties horizonProperties,
                          Clock clock) {
        this.riskModel = riskModel;
        this.cascadePredictor = cascadePredictor;
        this.protocolExecutor = protocolExecutor;
        this.policyAuthority = policyAuthority;
        this.adaptationEngine = adaptationEngine;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = horizonProperties.getVariety();
        this.clock = clock;
        this.internalCapacity = clampCapacity(config.getInitialCapacity());
        this.absorptionRate = config.getInitialAbsorptionRate();
        this.mailbox = new ComponentMailbox("variety-monitor");
    }

    @PostConstruct
    public void start() {
        monitoringActive = true;
        mailbox.every("variety-assessment", config.getAssessmentInterval(), this::assess);
        log.info("Variety monitor started: capacity={}, assessmentInterval={}",
                internalCapacity, config.getAssessmentInterval());
    }

    @PreDestroy
    public void stop() {
        monitoringActive = false;
        mailbox.shutdown();
    }

    // ========== Operations ==========

    /**
     * Assess a variety reading. Above the explosion threshold the reading is
     * absorbed or, when capacity is exceeded, escalated and met with an
     * emergency protocol before the report is returned.
     */
    public Mono<RiskReport> monitorVariety(VarietyData data) {
        return mailbox.request("monitor-variety", () -> monitor(data));
    }

    public Mono<ExplosionRiskAssessment> checkExplosionRisk() {
        return mailbox.request("check-explosion-risk", this::assessExplosionRisk);
    }

    public Mono<CascadePrediction> predictCascade(double currentVariety) {
        return mailbox.request("predict-cascade", () -> {
            CascadePrediction prediction = cascade(currentVariety);
            metrics.recordCascadePrediction(false);
            return prediction;
        });
    }

    public Mono<VarietyState> getVarietyState() {
        return mailbox.request("variety-state", this::snapshotState);
    }

    public Mono<List<ExplosionEvent>> getExplosionEvents() {
        return mailbox.request("explosion-events", () -> List.copyOf(explosionEvents));
    }

    public Mono<List<CascadePrediction>> getCascadePredictions() {
        return mailbox.request("cascade-predictions", () -> List.copyOf(cascadePredictions));
    }

    /**
     * Run the emergency protocol selected by the report's risk and record the response.
     */
    public void triggerEmergencyResponse(RiskReport report) {
        mailbox.tell("emergency-response", () -> {
            ProtocolResult result = protocolExecutor.respond(report, new ProtocolRun(activeMeasures));
            recordEvent(ExplosionEvent.builder()
                    .timestamp(clock.instant())
                    .eventType(ExplosionEventType.EMERGENCY_RESPONSE)
                    .explosionData(report)
                    .protocolUsed(result.getProtocol())
                    .responseResult(result)
                    .build());
        });
    }

    // ========== Monitoring ==========

    private RiskReport monitor(VarietyData data) {
        if (data == null) {
            throw SignalValidationException.missing("varietyData");
        }
        data.validate();
        Instant now = clock.instant();

        double external = riskModel.externalVariety(data);
        double capacity = internalCapacity;
        double ratio = external / capacity;
        VarietyTrend trend = riskModel.trend(List.copyOf(history));
        double risk = riskModel.explosionRisk(ratio, trend, absorptionRate);

        appendSample(new VarietySample(now, external));
        currentVarietyLevel = external;
        lastAssessedAt = now;
        double capability = riskModel.absorptionCapability(absorptionRate, external);

        RiskReport report = RiskReport.builder()
                .externalVariety(external)
                .internalCapacity(capacity)
                .varietyRatio(ratio)
                .explosionRisk(risk)
                .recommendedAction(RecommendedAction.forRisk(risk, ratio))
                .absorptionCapability(capability)
                .trend(trend)
                .timestamp(now)
                .build();

        metrics.recordAssessment(risk, ratio, capacity);
        structuredLogger.logVarietyEvent(VarietyEventType.ASSESSED, null, "Variety assessed", Map.of(
                "externalVariety", external,
                "varietyRatio", ratio,
                "explosionRisk", risk,
                "trend", trend,
                "recommendedAction", report.getRecommendedAction()));

        if (risk > config.getExplosionThreshold()) {
            handleExplosionThreat(report, now);
        }
        if (risk >= protocolExecutor.lowestTriggerThreshold()) {
            raiseVarietyChallenge(report);
        } else {
            releaseMeasures(risk);
        }
        return report;
    }

    private void raiseVarietyChallenge(RiskReport report) {
        if (varietyChallengeOpen) {
            return;
        }
        varietyChallengeOpen = true;
        Urgency urgency = report.getExplosionRisk() > config.getExplosionThreshold() ? Urgency.CRITICAL : Urgency.HIGH;
        structuredLogger.logVarietyEvent(VarietyEventType.ADAPTATION_REQUESTED, null,
                "Variety risk handed to adaptation", Map.of(
                        "explosionRisk", report.getExplosionRisk(),
                        "urgency", urgency));
        adaptationEngine.handleAdaptationNeeded(
                Challenge.of(ChallengeType.VARIETY_EXPLOSION, urgency, Scope.SYSTEM_WIDE));
    }

    private void releaseMeasures(double risk) {
        varietyChallengeOpen = false;
        if (activeMeasures.isEmpty()) {
            return;
        }
        structuredLogger.logVarietyEvent(VarietyEventType.MEASURES_RELEASED, null,
                "Variety risk subsided, releasing protective measures", Map.of(
                        "explosionRisk", risk,
                        "measures", List.copyOf(activeMeasures)));
        activeMeasures.clear();
    }

    private void handleExplosionThreat(RiskReport report, Instant now) {
        AbsorptionStrategy strategy = AbsorptionStrategy.forRatio(report.getVarietyRatio());
        structuredLogger.logVarietyEvent(VarietyEventType.THRESHOLD_EXCEEDED, null,
                "Variety explosion imminent", Map.of(
                        "explosionRisk", report.getExplosionRisk(),
                        "strategy", strategy));

        double variety = report.getExternalVariety();
        double capability = report.getAbsorptionCapability();
        if (variety <= capability) {
            AbsorptionOutcome outcome = AbsorptionOutcome.absorbed(strategy, variety, capability);
            report.setAbsorptionOutcome(outcome);
            absorptionRate = absorptionRate * 0.9 + 0.1;
            if (lastExplosionAt != null) {
                double recovery = Duration.between(lastExplosionAt, now).toMillis() / 1000.0;
                varietyMetrics = varietyMetrics.toBuilder().recoveryTime(recovery).build();
                lastExplosionAt = null;
            }
            structuredLogger.logVarietyEvent(VarietyEventType.ABSORBED, null, "Variety absorbed", Map.of(
                    "strategy", strategy,
                    "absorbed", outcome.getAbsorbed(),
                    "absorptionRate", absorptionRate));
            return;
        }

        report.setAbsorptionOutcome(AbsorptionOutcome.capacityExceeded(strategy, variety, capability));
        structuredLogger.logVarietyEvent(VarietyEventType.UNCONTROLLED_EXPLOSION, null,
                "Variety absorption failed, escalating to policy authority", Map.of(
                        "externalVariety", variety,
                        "absorptionCapability", capability,
                        "varietyRatio", report.getVarietyRatio()));

        ProtocolRun run = new ProtocolRun(activeMeasures);
        protocolExecutor.requestMetaSystem(report, run);
        ProtocolResult response = protocolExecutor.respond(report, run);
        report.setProtocolResult(response);

        lastExplosionAt = now;
        recordEvent(ExplosionEvent.builder()
                .timestamp(now)
                .eventType(ExplosionEventType.UNCONTROLLED_EXPLOSION)
                .explosionData(report)
                .protocolUsed(response.getProtocol())
                .responseResult(response)
                .build());
    }

    private void recordEvent(ExplosionEvent event) {
        explosionEvents.addLast(event);
        while (explosionEvents.size() > config.getExplosionEventLimit()) {
            explosionEvents.removeFirst();
        }
        explosionSinceLastAssessment = true;
        varietyMetrics = varietyMetrics.toBuilder()
                .explosionCount(varietyMetrics.getExplosionCount() + 1)
                .build();
        metrics.recordExplosion();
        eventProducer.emitExplosionEvent(event);
    }

    // ========== Risk and Cascade ==========

    private ExplosionRiskAssessment assessExplosionRisk() {
        List<VarietySample> samples = List.copyOf(history);
        double ratio = currentVarietyLevel / internalCapacity;
        VarietyTrend trend = riskModel.trend(samples);
        return ExplosionRiskAssessment.builder()
                .currentRisk(riskModel.explosionRisk(ratio, trend, absorptionRate))
                .trend(trend)
                .timeToExplosionSeconds(riskModel.timeToExplosionSeconds(samples, currentVarietyLevel, internalCapacity))
                .cascadeProbability(riskModel.cascadeProbability(ratio))
                .mitigationOptions(riskModel.mitigationOptions(currentVarietyLevel, internalCapacity))
                .build();
    }

    private CascadePrediction cascade(double variety) {
        CascadePrediction prediction = cascadePredictor.predict(variety, internalCapacity,
                riskModel.trend(List.copyOf(history)),
                riskModel.absorptionCapability(absorptionRate, currentVarietyLevel),
                clock.instant());
        cascadePredictions.addLast(prediction);
        while (cascadePredictions.size() > config.getCascadePredictionLimit()) {
            cascadePredictions.removeFirst();
        }
        varietyMetrics = varietyMetrics.toBuilder()
                .cascadeEvents(varietyMetrics.getCascadeEvents() + 1)
                .build();
        structuredLogger.logVarietyEvent(VarietyEventType.CASCADE_PREDICTED, null, "Cascade predicted", Map.of(
                "initialVariety", variety,
                "stages", prediction.getCascadeStages().size(),
                "peakVariety", prediction.getPeakVariety(),
                "containmentProbability", prediction.getContainmentProbability()));
        eventProducer.emitCascadePrediction(prediction);
        return prediction;
    }

    // ========== Periodic Assessment ==========

    /**
     * One periodic assessment. Package-private so tests can drive it without the timer.
     */
    void assess() {
        double ratio = currentVarietyLevel / internalCapacity;
        if (ratio > config.getCriticalRatio()) {
            CascadePrediction prediction = cascade(currentVarietyLevel);
            boolean escalate = prediction.getContainmentProbability() < 0.5;
            metrics.recordCascadePrediction(escalate);
            if (escalate) {
                structuredLogger.logVarietyEvent(VarietyEventType.CASCADE_ESCALATED, null,
                        "Cascade unlikely to be contained", Map.of(
                                "varietyRatio", ratio,
                                "containmentProbability", prediction.getContainmentProbability()));
                policyAuthority.handleCascadeRisk(new CascadeRiskReport(prediction, Urgency.HIGH,
                                CascadeRiskReport.PREEMPTIVE_META_SPAWN))
                        .subscribe(v -> { }, e -> log.warn("Cascade risk report failed: {}", e.getMessage()));
            }
        }
        adaptCapacity();
        lastAssessedAt = clock.instant();
    }

    private void adaptCapacity() {
        double previous = internalCapacity;
        double adapted;
        if (explosionSinceLastAssessment) {
            adapted = previous * 1.05;
        } else if (currentVarietyLevel < previous * 0.5) {
            adapted = previous * 0.98;
        } else {
            adapted = previous * 1.01;
        }
        internalCapacity = clampCapacity(adapted);
        explosionSinceLastAssessment = false;

        metrics.recordCapacity(currentVarietyLevel / internalCapacity, internalCapacity);
        structuredLogger.logVarietyEvent(VarietyEventType.CAPACITY_ADAPTED, null, "Internal capacity adapted",
                Map.of("previous", previous, "capacity", internalCapacity));
    }

    // ========== Private Helper Methods ==========

    private void appendSample(VarietySample sample) {
        history.addLast(sample);
        while (history.size() > config.getHistorySize()) {
            history.removeFirst();
        }
        long samples = varietyMetrics.getSamples() + 1;
        double average = varietyMetrics.getAverageVariety()
                + (sample.variety() - varietyMetrics.getAverageVariety()) / samples;
        varietyMetrics = varietyMetrics.toBuilder()
                .samples(samples)
                .averageVariety(average)
                .peakVariety(Math.max(varietyMetrics.getPeakVariety(), sample.variety()))
                .build();
    }

    private double clampCapacity(double capacity) {
        return Math.max(config.getMinCapacity(), Math.min(config.getMaxCapacity(), capacity));
    }

    private VarietyState snapshotState() {
        return VarietyState.builder()
                .currentVarietyLevel(currentVarietyLevel)
                .internalVarietyCapacity(internalCapacity)
                .varietyRatio(currentVarietyLevel / internalCapacity)
                .absorptionRate(absorptionRate)
                .explosionEventCount(explosionEvents.size())
                .cascadePredictionCount(cascadePredictions.size())
                .metrics(varietyMetrics)
                .activeMeasures(activeMeasures.isEmpty()
                        ? EnumSet.noneOf(ProtocolAction.class) : EnumSet.copyOf(activeMeasures))
                .monitoringActive(monitoringActive)
                .lastAssessedAt(lastAssessedAt)
                .build();
    }
}
