package com.z254.horizon.coordination;

import com.z254.horizon.adaptation.AdaptationEngine;
import com.z254.horizon.adaptation.DefensiveModel;
import com.z254.horizon.adaptation.ElapsedTimeTelemetry;
import com.z254.horizon.adaptation.IncrementalModel;
import com.z254.horizon.adaptation.TimelineResolver;
import com.z254.horizon.adaptation.TransformationalModel;
import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.PolicyAuthorityClient.AdaptationDecision;
import com.z254.horizon.client.ResourceAuthorityClient;
import com.z254.horizon.client.ResourceAuthorityClient.AllocationResult;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.coordination.IntelligenceCoordinator.IntelligenceCycle;
import com.z254.horizon.domain.model.Adaptation;
import com.z254.horizon.domain.model.AdaptationProposal;
import com.z254.horizon.domain.model.ChallengeType;
import com.z254.horizon.domain.model.DetectionResult;
import com.z254.horizon.domain.model.MarketSignal;
import com.z254.horizon.domain.model.MetaPattern;
import com.z254.horizon.domain.model.ModelType;
import com.z254.horizon.domain.model.PatternType;
import com.z254.horizon.domain.model.ScanScope;
import com.z254.horizon.domain.model.Scope;
import com.z254.horizon.domain.model.SignalSnapshot;
import com.z254.horizon.domain.model.Urgency;
import com.z254.horizon.domain.model.VarietyData;
import com.z254.horizon.kafka.IntelligenceEventProducer;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.pattern.PatternDetector;
import com.z254.horizon.scanner.EnvironmentalScanner;
import com.z254.horizon.support.MutableClock;
import com.z254.horizon.support.TestPatterns;
import com.z254.horizon.variety.CascadePredictor;
import com.z254.horizon.variety.EmergencyProtocolExecutor;
import com.z254.horizon.variety.ExplosionRiskModel;
import com.z254.horizon.variety.VarietyMonitor;
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs the scan, variety and adaptation components together behind the coordinator.
 */
@ExtendWith(MockitoExtension.class)
class IntelligenceCycleTest {

    @Mock
    private EnvironmentalScanner scanner;

    @Mock
    private PatternDetector patternDetector;

    @Mock
    private PolicyAuthorityClient policyAuthority;

    @Mock
    private ResourceAuthorityClient resourceAuthority;

    @Mock
    private IntelligenceEventProducer eventProducer;

    private MutableClock clock;
    private VarietyMonitor varietyMonitor;
    private AdaptationEngine adaptationEngine;
    private IntelligenceCoordinator coordinator;

    @BeforeEach
    void setUp() {
        HorizonProperties properties = new HorizonProperties();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        HorizonMetrics metrics = new HorizonMetrics(registry);
        HorizonStructuredLogger logger = new HorizonStructuredLogger();
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");

        lenient().when(policyAuthority.spawnMetaSystemEmergency(any())).thenReturn(Mono.empty());
        lenient().when(resourceAuthority.redistributeVariety(any())).thenReturn(Mono.empty());
        lenient().when(resourceAuthority.allocateForAdaptation(any())).thenReturn(Mono.just(AllocationResult.grant()));
        lenient().when(policyAuthority.approveAdaptation(any())).thenAnswer(invocation -> {
            AdaptationProposal proposal = invocation.getArgument(0);
            return Mono.just(new AdaptationDecision(proposal.getId(), true, null, clock.instant()));
        });

        adaptationEngine = new AdaptationEngine(
                List.of(new IncrementalModel(), new TransformationalModel(), new DefensiveModel()),
                new TimelineResolver(properties),
                new ElapsedTimeTelemetry(),
                policyAuthority,
                resourceAuthority,
                eventProducer,
                metrics,
                logger,
                properties,
                clock);
        varietyMonitor = new VarietyMonitor(
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
        coordinator = new IntelligenceCoordinator(scanner, patternDetector, varietyMonitor, adaptationEngine);
    }

    @AfterEach
    void tearDown() {
        varietyMonitor.stop();
        adaptationEngine.stop();
    }

    private static VarietyData indicators(int novel, int emergent) {
        Map<String, Object> novelPatterns = new HashMap<>();
        for (int i = 0; i < novel; i++) {
            novelPatterns.put("novel-" + i, i);
        }
        List<String> emergentProperties = new ArrayList<>();
        for (int i = 0; i < emergent; i++) {
            emergentProperties.add("property-" + i);
        }
        return VarietyData.builder().novelPatterns(novelPatterns).emergentProperties(emergentProperties).build();
    }

    private static SignalSnapshot snapshotWith(VarietyData variety) {
        return SignalSnapshot.builder()
                .marketSignals(List.of(new MarketSignal("increased_demand", 0.7, "sales_data")))
                .llmVariety(variety)
                .scope(ScanScope.FULL)
                .build();
    }

    /**
     * Wait until queued adaptation work, including approvals it triggered, has run.
     */
    private List<Adaptation> activeAdaptations() {
        adaptationEngine.getActiveAdaptations().block();
        return adaptationEngine.getActiveAdaptations().block();
    }

    @Nested
    @DisplayName("Full cycle")
    class FullCycleTests {

        @Test
        @DisplayName("should turn an explosive scan into a defensive system-wide adaptation")
        void scanToAdaptation() {
            SignalSnapshot snapshot = snapshotWith(indicators(5, 5));
            DetectionResult detection = DetectionResult.builder()
                    .patterns(List.of(TestPatterns.pattern("p-1", PatternType.BEHAVIORAL, 0.8)))
                    .metaPatterns(List.of(MetaPattern.builder().id("m-1").build()))
                    .build();
            when(scanner.scan(ScanScope.FULL)).thenReturn(Mono.just(snapshot));
            when(patternDetector.detectPatterns(snapshot)).thenReturn(Mono.just(detection));

            IntelligenceCycle cycle = coordinator.runIntelligenceCycle(ScanScope.FULL).block();

            assertThat(cycle.snapshot()).isSameAs(snapshot);
            assertThat(cycle.detection()).isSameAs(detection);
            assertThat(cycle.riskReport().getExternalVariety()).isCloseTo(3.0, within(1e-9));
            assertThat(cycle.riskReport().getExplosionRisk()).isEqualTo(1.0);
            assertThat(cycle.riskReport().getAbsorptionOutcome().isCapacityExceeded()).isTrue();

            assertThat(activeAdaptations()).singleElement().satisfies(a -> {
                assertThat(a.getProposal().getModelType()).isEqualTo(ModelType.DEFENSIVE);
                assertThat(a.getProposal().getChallenge().getType()).isEqualTo(ChallengeType.VARIETY_EXPLOSION);
                assertThat(a.getProposal().getChallenge().getUrgency()).isEqualTo(Urgency.CRITICAL);
                assertThat(a.getProposal().getChallenge().getScope()).isEqualTo(Scope.SYSTEM_WIDE);
            });
        }

        @Test
        @DisplayName("should assess quiet variety without starting an adaptation")
        void quietScan() {
            SignalSnapshot snapshot = snapshotWith(indicators(1, 0));
            when(scanner.scan(ScanScope.FULL)).thenReturn(Mono.just(snapshot));
            when(patternDetector.detectPatterns(snapshot)).thenReturn(Mono.just(DetectionResult.empty(0.0)));

            IntelligenceCycle cycle = coordinator.runIntelligenceCycle(ScanScope.FULL).block();

            assertThat(cycle.riskReport().getExplosionRisk()).isLessThan(0.6);
            assertThat(activeAdaptations()).isEmpty();
        }

        @Test
        @DisplayName("should skip detection and variety for an unavailable source")
        void unavailableSource() {
            SignalSnapshot snapshot = SignalSnapshot.unavailable(ScanScope.FULL, clock.instant());
            when(scanner.scan(ScanScope.FULL)).thenReturn(Mono.just(snapshot));

            StepVerifier.create(coordinator.runIntelligenceCycle(ScanScope.FULL))
                    .assertNext(cycle -> {
                        assertThat(cycle.detection()).isNull();
                        assertThat(cycle.riskReport()).isNull();
                    })
                    .verifyComplete();

            verifyNoInteractions(patternDetector);
            assertThat(varietyMonitor.getVarietyState().block().getMetrics().getSamples()).isZero();
        }
    }

    @Nested
    @DisplayName("Variety reading")
    class VarietyReadingTests {

        @Test
        @DisplayName("should count detected patterns as novel and meta-patterns as emergent")
        void mergesDetection() {
            SignalSnapshot snapshot = snapshotWith(indicators(2, 1));
            DetectionResult detection = DetectionResult.builder()
                    .patterns(List.of(TestPatterns.pattern("p-1", PatternType.SPATIAL, 0.5)))
                    .metaPatterns(List.of(MetaPattern.builder().id("m-1").build()))
                    .build();

            VarietyData reading = IntelligenceCoordinator.varietyReading(snapshot, detection).orElseThrow();

            assertThat(reading.getNovelPatterns()).hasSize(3).containsEntry("p-1", PatternType.SPATIAL);
            assertThat(reading.getEmergentProperties()).containsExactly("property-0", "m-1");
            assertThat(snapshot.getLlmVariety().getNovelPatterns()).hasSize(2);
        }

        @Test
        @DisplayName("should assess detections even without variety indicators")
        void detectionOnly() {
            DetectionResult detection = DetectionResult.builder()
                    .patterns(List.of(TestPatterns.pattern("p-1", PatternType.TEMPORAL, 0.5)))
                    .build();

            Optional<VarietyData> reading = IntelligenceCoordinator.varietyReading(snapshotWith(null), detection);

            assertThat(reading).hasValueSatisfying(r -> assertThat(r.getNovelPatterns()).containsOnlyKeys("p-1"));
        }

        @Test
        @DisplayName("should have nothing to assess without indicators or detections")
        void nothingToAssess() {
            assertThat(IntelligenceCoordinator.varietyReading(snapshotWith(null), DetectionResult.empty(0.0)))
                    .isEmpty();
            assertThat(IntelligenceCoordinator.varietyReading(snapshotWith(null), null)).isEmpty();
        }
    }
}
