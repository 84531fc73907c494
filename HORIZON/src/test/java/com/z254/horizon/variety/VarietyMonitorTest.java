package com.z254.horizon.variety;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.horizon.adaptation.AdaptationEngine;
import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.PolicyAuthorityClient.CascadeRiskReport;
import com.z254.horizon.client.ResourceAuthorityClient;
import com.z254.horizon.client.ResourceAuthorityClient.VarietyRedistributionRequest;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.exception.SignalValidationException;
import com.z254.horizon.domain.model.AbsorptionStrategy;
import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ChallengeType;
import com.z254.horizon.domain.model.ExplosionEvent;
import com.z254.horizon.domain.model.ExplosionEventType;
import com.z254.horizon.domain.model.ExplosionRiskAssessment;
import com.z254.horizon.domain.model.ProtocolAction;
import com.z254.horizon.domain.model.ProtocolName;
import com.z254.horizon.domain.model.RecommendedAction;
import com.z254.horizon.domain.model.RiskReport;
import com.z254.horizon.domain.model.Scope;
import com.z254.horizon.domain.model.Urgency;
import com.z254.horizon.domain.model.VarietyData;
import com.z254.horizon.domain.model.VarietyState;
import com.z254.horizon.kafka.IntelligenceEventProducer;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class VarietyMonitorTest {

    @Mock
    private PolicyAuthorityClient policyAuthority;

    @Mock
    private ResourceAuthorityClient resourceAuthority;

    @Mock
    private AdaptationEngine adaptationEngine;

    @Mock
    private IntelligenceEventProducer eventProducer;

    private HorizonProperties properties;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private VarietyMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = new HorizonProperties();
        registry = new SimpleMeterRegistry();
        clock = MutableClock.startingAt("2024-06-01T08:00:00Z");
        lenient().when(policyAuthority.spawnMetaSystemEmergency(any())).thenReturn(Mono.empty());
        lenient().when(policyAuthority.handleCascadeRisk(any())).thenReturn(Mono.empty());
        lenient().when(resourceAuthority.redistributeVariety(any())).thenReturn(Mono.empty());
        monitor = newMonitor();
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    private VarietyMonitor newMonitor() {
        HorizonMetrics metrics = new HorizonMetrics(registry);
        HorizonStructuredLogger logger = new HorizonStructuredLogger();
        return new VarietyMonitor(
                new ExplosionRiskModel(properties),
                new CascadePredictor(),
                new EmergencyProtocolExecutor(policyAuthority, resourceAuthority, metrics, logger, properties, clock),
                policyAuthority,
                adaptationEngine,
                eventProducer,
                metrics,
                logger,
                properties,
                clock);
    }

    /**
     * Indicators worth {@code 0.3·novel + 0.2·emergent} variety.
     */
    private static VarietyData indicators(int novel, int emergent) {
        Map<String, Object> novelPatterns = new HashMap<>();
        for (int i = 0; i < novel; i++) {
            novelPatterns.put("novel-" + i, i);
        }
        List<String> emergentProperties = new ArrayList<>();
        for (int i = 0; i < emergent; i++) {
            emergentProperties.add("property-" + i);
        }
        return VarietyData.builder()
                .novelPatterns(novelPatterns)
                .emergentProperties(emergentProperties)
                .build();
    }

    private VarietyState state() {
        return monitor.getVarietyState().block();
    }

    @Nested
    @DisplayName("Variety monitoring")
    class MonitoringTests {

        @Test
        @DisplayName("should escalate a reading that exceeds absorption capability")
        void uncontrolledExplosion() {
            RiskReport report = monitor.monitorVariety(indicators(5, 5)).block();

            assertThat(report.getExternalVariety()).isCloseTo(2.5, within(1e-9));
            assertThat(report.getInternalCapacity()).isEqualTo(1.0);
            assertThat(report.getVarietyRatio()).isCloseTo(2.5, within(1e-9));
            assertThat(report.getExplosionRisk()).isEqualTo(1.0);
            assertThat(report.getRecommendedAction()).isEqualTo(RecommendedAction.IMMEDIATE_META_SYSTEM_SPAWN);
            assertThat(report.getAbsorptionCapability()).isCloseTo(0.525, within(1e-9));
            assertThat(report.getAbsorptionOutcome().isCapacityExceeded()).isTrue();
            assertThat(report.getAbsorptionOutcome().getStrategy()).isEqualTo(AbsorptionStrategy.SELECTIVE);
            assertThat(report.getProtocolResult().getProtocol()).isEqualTo(ProtocolName.META_SPAWN);

            verify(policyAuthority, times(1)).spawnMetaSystemEmergency(argThat(r -> r.urgency() == Urgency.CRITICAL));
            verify(resourceAuthority).redistributeVariety(new VarietyRedistributionRequest(
                    report.getExternalVariety(), 1.0, report.getVarietyRatio(), 1.0, clock.instant()));
            verify(eventProducer).emitExplosionEvent(any());

            List<ExplosionEvent> events = monitor.getExplosionEvents().block();
            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.getEventType()).isEqualTo(ExplosionEventType.UNCONTROLLED_EXPLOSION);
                assertThat(e.getProtocolUsed()).isEqualTo(ProtocolName.META_SPAWN);
            });
            assertThat(state().getMetrics().getExplosionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should only recommend monitoring for a quiet reading")
        void quietReading() {
            RiskReport report = monitor.monitorVariety(indicators(1, 0)).block();

            assertThat(report.getRecommendedAction()).isEqualTo(RecommendedAction.MONITOR);
            assertThat(report.getAbsorptionOutcome()).isNull();
            assertThat(report.getProtocolResult()).isNull();
            verify(policyAuthority, never()).spawnMetaSystemEmergency(any());
        }

        @Test
        @DisplayName("should absorb a reading within capability and strengthen absorption")
        void absorbed() {
            properties.getVariety().setExplosionThreshold(0.1);

            RiskReport report = monitor.monitorVariety(indicators(1, 0)).block();

            assertThat(report.getAbsorptionOutcome().isCapacityExceeded()).isFalse();
            assertThat(report.getAbsorptionOutcome().getStrategy()).isEqualTo(AbsorptionStrategy.NORMAL);
            assertThat(report.getAbsorptionOutcome().getAbsorbed()).isCloseTo(0.09, within(1e-9));
            assertThat(state().getAbsorptionRate()).isCloseTo(0.73, within(1e-9));
            assertThat(monitor.getExplosionEvents().block()).isEmpty();
        }

        @Test
        @DisplayName("should measure recovery from the last explosion to the next absorbed reading")
        void recoveryTime() {
            properties.getVariety().setExplosionThreshold(0.1);
            monitor.monitorVariety(indicators(5, 5)).block();
            clock.advance(Duration.ofSeconds(30));

            monitor.monitorVariety(indicators(1, 0)).block();

            assertThat(state().getMetrics().getRecoveryTime()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("should reject a missing reading")
        void missingReading() {
            StepVerifier.create(monitor.monitorVariety(null))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(SignalValidationException.class);
                        assertThat(((SignalValidationException) e).getField()).isEqualTo("varietyData");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should reject a reading with a missing indicator family")
        void missingFamily() {
            VarietyData data = VarietyData.builder().emergentProperties(null).build();

            StepVerifier.create(monitor.monitorVariety(data))
                    .expectError(SignalValidationException.class)
                    .verify();
            assertThat(state().getMetrics().getSamples()).isZero();
        }

        @Test
        @DisplayName("should track running variety statistics")
        void statistics() {
            monitor.monitorVariety(indicators(1, 0)).block();
            monitor.monitorVariety(indicators(3, 0)).block();

            VarietyState state = state();
            assertThat(state.getMetrics().getSamples()).isEqualTo(2);
            assertThat(state.getMetrics().getAverageVariety()).isCloseTo(0.6, within(1e-9));
            assertThat(state.getMetrics().getPeakVariety()).isCloseTo(0.9, within(1e-9));
            assertThat(state.getCurrentVarietyLevel()).isCloseTo(0.9, within(1e-9));
            assertThat(state.getVarietyRatio()).isCloseTo(0.9, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Adaptation hand-off")
    class AdaptationHandOffTests {

        @Test
        @DisplayName("should raise a critical variety challenge for an explosive reading")
        void criticalChallenge() {
            monitor.monitorVariety(indicators(5, 5)).block();

            verify(adaptationEngine).handleAdaptationNeeded(
                    Challenge.of(ChallengeType.VARIETY_EXPLOSION, Urgency.CRITICAL, Scope.SYSTEM_WIDE));
        }

        @Test
        @DisplayName("should raise a high-urgency challenge between the protocol and explosion thresholds")
        void highChallenge() {
            RiskReport report = monitor.monitorVariety(indicators(5, 0)).block();

            assertThat(report.getExplosionRisk()).isCloseTo(0.65, within(1e-9));
            assertThat(report.getAbsorptionOutcome()).isNull();
            verify(adaptationEngine).handleAdaptationNeeded(
                    Challenge.of(ChallengeType.VARIETY_EXPLOSION, Urgency.HIGH, Scope.SYSTEM_WIDE));
        }

        @Test
        @DisplayName("should raise one challenge per episode of elevated risk")
        void oneChallengePerEpisode() {
            monitor.monitorVariety(indicators(5, 0)).block();
            monitor.monitorVariety(indicators(5, 0)).block();
            verify(adaptationEngine, times(1)).handleAdaptationNeeded(any());

            monitor.monitorVariety(indicators(1, 0)).block();
            monitor.monitorVariety(indicators(8, 0)).block();

            verify(adaptationEngine, times(2)).handleAdaptationNeeded(any());
        }

        @Test
        @DisplayName("should not involve adaptation for a quiet reading")
        void quietReading() {
            monitor.monitorVariety(indicators(1, 0)).block();

            verify(adaptationEngine, never()).handleAdaptationNeeded(any());
        }

        @Test
        @DisplayName("should release protective measures once risk subsides")
        void releasesMeasures() {
            monitor.triggerEmergencyResponse(RiskReport.builder()
                    .externalVariety(2.0).varietyRatio(2.0).explosionRisk(0.72).build());
            assertThat(state().getActiveMeasures())
                    .containsExactlyInAnyOrder(ProtocolAction.ACTIVATE_FILTERS, ProtocolAction.REDUCE_INPUTS);

            monitor.monitorVariety(indicators(1, 0)).block();

            assertThat(state().getActiveMeasures()).isEmpty();
        }

        @Test
        @DisplayName("should keep protective measures while risk stays elevated")
        void keepsMeasures() {
            monitor.triggerEmergencyResponse(RiskReport.builder()
                    .externalVariety(2.0).varietyRatio(2.0).explosionRisk(0.72).build());

            monitor.monitorVariety(indicators(5, 0)).block();

            assertThat(state().getActiveMeasures()).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("Risk and cascades")
    class RiskTests {

        @Test
        @DisplayName("should project time to explosion from the latest readings")
        void timeToExplosion() {
            monitor.monitorVariety(indicators(0, 5)).block();
            clock.advance(Duration.ofSeconds(2));
            monitor.monitorVariety(indicators(0, 10)).block();

            ExplosionRiskAssessment assessment = monitor.checkExplosionRisk().block();

            assertThat(assessment.getTimeToExplosionSeconds()).isCloseTo(2.0, within(1e-9));
            assertThat(assessment.isExplosionImminent()).isTrue();
            assertThat(assessment.getCascadeProbability()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should record on-demand cascade predictions")
        void onDemandCascade() {
            StepVerifier.create(monitor.predictCascade(5.0))
                    .assertNext(p -> assertThat(p.getCascadeStages()).hasSize(4))
                    .verifyComplete();

            assertThat(state().getCascadePredictionCount()).isEqualTo(1);
            assertThat(state().getMetrics().getCascadeEvents()).isEqualTo(1);
            assertThat(registry.get("horizon.variety.cascade.predictions").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("horizon.variety.cascade.escalations").counter().count()).isZero();
            verify(eventProducer).emitCascadePrediction(any());
        }

        @Test
        @DisplayName("should record an emergency response event")
        void emergencyResponse() {
            RiskReport report = RiskReport.builder().externalVariety(2.0).varietyRatio(2.0).explosionRisk(0.72).build();

            monitor.triggerEmergencyResponse(report);

            assertThat(monitor.getExplosionEvents().block()).singleElement().satisfies(e -> {
                assertThat(e.getEventType()).isEqualTo(ExplosionEventType.EMERGENCY_RESPONSE);
                assertThat(e.getProtocolUsed()).isEqualTo(ProtocolName.EMERGENCY_FILTER);
            });
            assertThat(state().getActiveMeasures()).isNotEmpty();
        }

        @Test
        @DisplayName("should hand out measures that do not write back into the monitor")
        void detachedMeasures() {
            monitor.triggerEmergencyResponse(
                    RiskReport.builder().externalVariety(2.0).varietyRatio(2.0).explosionRisk(0.72).build());

            state().getActiveMeasures().clear();

            assertThat(state().getActiveMeasures())
                    .containsExactlyInAnyOrder(ProtocolAction.ACTIVATE_FILTERS, ProtocolAction.REDUCE_INPUTS);
        }
    }

    @Nested
    @DisplayName("Periodic assessment")
    class AssessmentTests {

        @Test
        @DisplayName("should escalate an uncontainable cascade at a critical ratio")
        void cascadeEscalation() {
            monitor.monitorVariety(indicators(12, 0)).block();

            monitor.assess();

            verify(policyAuthority).handleCascadeRisk(argThat((CascadeRiskReport r) ->
                    r.urgency() == Urgency.HIGH
                            && r.recommendedAction().equals(CascadeRiskReport.PREEMPTIVE_META_SPAWN)));
            assertThat(monitor.getCascadePredictions().block()).hasSize(1);
            assertThat(registry.get("horizon.variety.cascade.escalations").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should grow capacity after an explosion")
        void growsAfterExplosion() {
            monitor.monitorVariety(indicators(5, 5)).block();

            monitor.assess();

            assertThat(state().getInternalVarietyCapacity()).isCloseTo(1.05, within(1e-9));
            assertThat(state().getLastAssessedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should shrink capacity while variety stays low")
        void shrinksWhenIdle() {
            monitor.assess();

            assertThat(state().getInternalVarietyCapacity()).isCloseTo(0.98, within(1e-9));
        }

        @Test
        @DisplayName("should grow capacity slowly under moderate load")
        void growsUnderLoad() {
            monitor.monitorVariety(indicators(2, 0)).block();

            monitor.assess();

            assertThat(state().getInternalVarietyCapacity()).isCloseTo(1.01, within(1e-9));
        }

        @Test
        @DisplayName("should never shrink capacity below its floor")
        void floor() {
            for (int i = 0; i < 100; i++) {
                monitor.assess();
            }

            assertThat(state().getInternalVarietyCapacity()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("should never grow capacity above its ceiling")
        void ceiling() {
            RiskReport report = RiskReport.builder().explosionRisk(0.0).build();
            for (int i = 0; i < 100; i++) {
                monitor.triggerEmergencyResponse(report);
                state();
                monitor.assess();
            }

            assertThat(state().getInternalVarietyCapacity()).isEqualTo(10.0);
            assertThat(monitor.getExplosionEvents().block()).hasSize(100);
        }
    }

    @Nested
    @DisplayName("State snapshot")
    class StateTests {

        @Test
        @DisplayName("should derive the ratio from the level and capacity captured together")
        void ratioMatchesLevelOverCapacity() {
            monitor.monitorVariety(indicators(3, 1)).block();
            monitor.assess();

            VarietyState snapshot = state();

            assertThat(snapshot.getVarietyRatio())
                    .isEqualTo(snapshot.getCurrentVarietyLevel() / snapshot.getInternalVarietyCapacity());
        }

        @Test
        @DisplayName("should reproduce the same snapshot without intervening mutation")
        void idempotentSnapshot() throws Exception {
            monitor.monitorVariety(indicators(5, 5)).block();
            monitor.assess();
            ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

            VarietyState first = state();
            VarietyState second = state();
            VarietyState restored = objectMapper.readValue(objectMapper.writeValueAsString(first), VarietyState.class);

            assertThat(second).isEqualTo(first);
            assertThat(restored).isEqualTo(first);
        }
    }

    @Test
    @DisplayName("should only report monitoring active once started")
    void lifecycle() {
        assertThat(state().isMonitoringActive()).isFalse();

        monitor.start();

        assertThat(state().isMonitoringActive()).isTrue();
    }
}
