package com.z254.horizon.variety;

import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.PolicyAuthorityClient.MetaSystemSpawnRequest;
import com.z254.horizon.client.ResourceAuthorityClient;
import com.z254.horizon.client.ResourceAuthorityClient.VarietyRedistributionRequest;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.ActionResult;
import com.z254.horizon.domain.model.ProtocolAction;
import com.z254.horizon.domain.model.ProtocolName;
import com.z254.horizon.domain.model.ProtocolResult;
import com.z254.horizon.domain.model.RiskReport;
import com.z254.horizon.domain.model.Urgency;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EmergencyProtocolExecutorTest {

    @Mock
    private PolicyAuthorityClient policyAuthority;

    @Mock
    private ResourceAuthorityClient resourceAuthority;

    private HorizonProperties properties;
    private SimpleMeterRegistry registry;
    private EmergencyProtocolExecutor executor;
    private Set<ProtocolAction> activeMeasures;

    @BeforeEach
    void setUp() {
        properties = new HorizonProperties();
        registry = new SimpleMeterRegistry();
        lenient().when(policyAuthority.spawnMetaSystemEmergency(any())).thenReturn(Mono.empty());
        lenient().when(resourceAuthority.redistributeVariety(any())).thenReturn(Mono.empty());
        executor = new EmergencyProtocolExecutor(policyAuthority, resourceAuthority,
                new HorizonMetrics(registry), new HorizonStructuredLogger(), properties,
                MutableClock.startingAt("2024-01-01T00:00:00Z"));
        activeMeasures = EnumSet.noneOf(ProtocolAction.class);
    }

    private static RiskReport report(double risk) {
        return RiskReport.builder()
                .externalVariety(2.5)
                .internalCapacity(1.0)
                .varietyRatio(2.5)
                .explosionRisk(risk)
                .build();
    }

    private void configure(ProtocolName name, String... actions) {
        properties.getVariety().getProtocols().get(name).setActions(new ArrayList<>(List.of(actions)));
    }

    @Nested
    @DisplayName("Protocol selection")
    class SelectionTests {

        @Test
        @DisplayName("should pick the highest threshold not above the risk")
        void highestSatisfied() {
            assertThat(executor.select(0.95)).contains(ProtocolName.META_SPAWN);
            assertThat(executor.select(0.9)).contains(ProtocolName.META_SPAWN);
            assertThat(executor.select(0.8)).contains(ProtocolName.CASCADE_PREVENTION);
            assertThat(executor.select(0.72)).contains(ProtocolName.EMERGENCY_FILTER);
            assertThat(executor.select(0.6)).contains(ProtocolName.CONTROLLED_DEGRADATION);
        }

        @Test
        @DisplayName("should select nothing below every threshold")
        void belowAll() {
            assertThat(executor.select(0.59)).isEmpty();

            ProtocolResult result = executor.respond(report(0.5), new ProtocolRun(activeMeasures));

            assertThat(result.isExecuted()).isFalse();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getActionResults()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Protocol execution")
    class ExecutionTests {

        @Test
        @DisplayName("should spawn a meta-system and redistribute variety for META_SPAWN")
        void metaSpawn() {
            ProtocolRun run = new ProtocolRun(activeMeasures);

            ProtocolResult result = executor.respond(report(0.95), run);

            assertThat(result.getProtocol()).isEqualTo(ProtocolName.META_SPAWN);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getActionResults()).extracting(ActionResult::getAction)
                    .containsExactly("spawn_meta_system", "redistribute_variety");
            assertThat(run.isMetaSystemRequested()).isTrue();
            verify(policyAuthority).spawnMetaSystemEmergency(argThat(r ->
                    r.reason().equals(MetaSystemSpawnRequest.VARIETY_EXPLOSION)
                            && r.urgency() == Urgency.CRITICAL
                            && r.metaSystemType().equals(MetaSystemSpawnRequest.VARIETY_ABSORBER)
                            && r.varietyRatio() == 2.5));
            verify(resourceAuthority).redistributeVariety(any());
            assertThat(registry.get("horizon.variety.protocols.executed")
                    .tag("protocol", "meta_spawn").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should send the resource authority a copy the report cannot change")
        void redistributionIsDetached() {
            RiskReport report = report(0.95);
            ArgumentCaptor<VarietyRedistributionRequest> sent = ArgumentCaptor.forClass(VarietyRedistributionRequest.class);

            ProtocolResult result = executor.respond(report, new ProtocolRun(activeMeasures));
            report.setProtocolResult(result);
            report.setExplosionRisk(0.1);

            verify(resourceAuthority).redistributeVariety(sent.capture());
            assertThat(sent.getValue().explosionRisk()).isEqualTo(0.95);
            assertThat(sent.getValue().varietyRatio()).isEqualTo(2.5);
            assertThat(sent.getValue().internalCapacity()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should request at most one meta-system per run")
        void oneSpawnPerRun() {
            ProtocolRun run = new ProtocolRun(activeMeasures);

            assertThat(executor.requestMetaSystem(report(0.95), run)).isTrue();
            ProtocolResult result = executor.respond(report(0.95), run);

            verify(policyAuthority, times(1)).spawnMetaSystemEmergency(any());
            assertThat(result.getActionResults().get(0).getDetail()).isEqualTo("meta-system already requested");
        }

        @Test
        @DisplayName("should keep running after an unknown action and report failure")
        void unknownAction() {
            configure(ProtocolName.CASCADE_PREVENTION, "isolate_subsystems", "warp_drive", "activate_dampeners");

            ProtocolResult result = executor.respond(report(0.8), new ProtocolRun(activeMeasures));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getActionResults()).hasSize(3);
            assertThat(result.getActionResults().get(1)).satisfies(r -> {
                assertThat(r.getAction()).isEqualTo("warp_drive");
                assertThat(r.isSuccess()).isFalse();
                assertThat(r.getDetail()).isEqualTo(ActionResult.UNKNOWN_ACTION);
            });
            assertThat(activeMeasures).containsExactlyInAnyOrder(
                    ProtocolAction.ISOLATE_SUBSYSTEMS, ProtocolAction.ACTIVATE_DAMPENERS);
            assertThat(registry.get("horizon.variety.protocol.action_failures").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should apply a repeated action only once per run")
        void idempotentActions() {
            configure(ProtocolName.EMERGENCY_FILTER, "activate_filters", "activate_filters");

            ProtocolResult result = executor.respond(report(0.72), new ProtocolRun(activeMeasures));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getActionResults()).extracting(ActionResult::getDetail)
                    .containsExactly("measure active", "already applied in this run");
            assertThat(activeMeasures).containsExactly(ProtocolAction.ACTIVATE_FILTERS);
        }

        @Test
        @DisplayName("should not contact collaborators for local measures")
        void localMeasures() {
            executor.respond(report(0.6), new ProtocolRun(activeMeasures));

            assertThat(activeMeasures).containsExactlyInAnyOrder(
                    ProtocolAction.REDUCE_FUNCTIONALITY, ProtocolAction.PRESERVE_CORE);
            verify(policyAuthority, never()).spawnMetaSystemEmergency(any());
            verify(resourceAuthority, never()).redistributeVariety(any());
        }

        @Test
        @DisplayName("should log and survive a failing spawn request")
        void spawnFailure() {
            lenient().when(policyAuthority.spawnMetaSystemEmergency(any()))
                    .thenReturn(Mono.error(new IllegalStateException("authority down")));

            ProtocolResult result = executor.respond(report(0.95), new ProtocolRun(activeMeasures));

            assertThat(result.isSuccess()).isTrue();
        }
    }
}
