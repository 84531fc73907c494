package com.z254.horizon.adaptation;

import com.z254.horizon.adaptation.AdaptationTelemetry.Verdict;
import com.z254.horizon.domain.model.Adaptation;
import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ChallengeType;
import com.z254.horizon.domain.model.Scope;
import com.z254.horizon.domain.model.SignalLevel;
import com.z254.horizon.domain.model.Urgency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AdaptationModelTest {

    private static Challenge challenge(ChallengeType type, Scope scope) {
        return Challenge.of(type, Urgency.MEDIUM, scope);
    }

    @Nested
    @DisplayName("Incremental model")
    class IncrementalTests {

        private final AdaptationModel model = new IncrementalModel();

        @Test
        @DisplayName("should streamline operations for efficiency challenges only")
        void actions() {
            assertThat(model.generateActions(challenge(ChallengeType.EFFICIENCY, Scope.TACTICAL)))
                    .containsExactly("optimize_processes", "enhance_features", "streamline_operations");
            assertThat(model.generateActions(challenge(ChallengeType.HEALTH, Scope.TACTICAL)))
                    .containsExactly("optimize_processes", "enhance_features");
        }

        @Test
        @DisplayName("should estimate a low, short commitment")
        void estimates() {
            Challenge challenge = challenge(ChallengeType.EFFICIENCY, Scope.OPERATIONAL);

            assertThat(model.estimateImpact(challenge)).isCloseTo(0.225, within(1e-9));
            assertThat(model.estimateResources(challenge).intensity()).isEqualTo(SignalLevel.LOW);
            assertThat(model.estimateTimeline(challenge)).isEqualTo("1_month");
            assertThat(model.identifyRisks(challenge)).containsExactly("minimal_disruption");
        }
    }

    @Nested
    @DisplayName("Transformational model")
    class TransformationalTests {

        private final AdaptationModel model = new TransformationalModel();

        @Test
        @DisplayName("should add a challenge-specific action")
        void actions() {
            assertThat(model.generateActions(challenge(ChallengeType.TECHNOLOGY_DISRUPTION, Scope.STRATEGIC)))
                    .containsExactly("restructure_operations", "new_capabilities", "adopt_new_tech");
            assertThat(model.generateActions(challenge(ChallengeType.INNOVATION, Scope.STRATEGIC)))
                    .containsExactly("restructure_operations", "new_capabilities");
        }

        @Test
        @DisplayName("should scale impact strongly with scope")
        void impact() {
            assertThat(model.estimateImpact(challenge(ChallengeType.INNOVATION, Scope.SYSTEM_WIDE)))
                    .isCloseTo(0.8, within(1e-9));
            assertThat(model.estimateResources(challenge(ChallengeType.INNOVATION, Scope.SYSTEM_WIDE)).duration())
                    .isEqualTo("3_months");
            assertThat(model.estimateTimeline(challenge(ChallengeType.INNOVATION, Scope.SYSTEM_WIDE)))
                    .isEqualTo("6_months");
        }
    }

    @Nested
    @DisplayName("Defensive model")
    class DefensiveTests {

        private final AdaptationModel model = new DefensiveModel();

        @Test
        @DisplayName("should stabilize in an emergency health challenge")
        void health() {
            assertThat(model.generateActions(challenge(ChallengeType.HEALTH, Scope.SYSTEM_WIDE)))
                    .containsExactly("strengthen_core", "reduce_exposure", "emergency_stabilization");
            assertThat(model.generateActions(challenge(ChallengeType.VARIETY_EXPLOSION, Scope.SYSTEM_WIDE)))
                    .containsExactly("strengthen_core", "reduce_exposure");
        }

        @Test
        @DisplayName("should name the cost of defending")
        void risks() {
            assertThat(model.identifyRisks(challenge(ChallengeType.HEALTH, Scope.TACTICAL)))
                    .containsExactly("opportunity_loss", "competitive_disadvantage");
            assertThat(model.estimateResources(challenge(ChallengeType.HEALTH, Scope.TACTICAL)).intensity())
                    .isEqualTo(SignalLevel.MEDIUM);
        }
    }

    @Nested
    @DisplayName("Elapsed-time telemetry")
    class TelemetryTests {

        private final AdaptationTelemetry telemetry = new ElapsedTimeTelemetry();

        @Test
        @DisplayName("should confirm an unconstrained adaptation at the threshold")
        void confirmed() {
            Adaptation adaptation = Adaptation.builder().resourceConstrained(false).build();

            assertThat(telemetry.assessCompletion(adaptation, 0.9)).isEqualTo(Verdict.CONFIRMED);
        }

        @Test
        @DisplayName("should hold a constrained adaptation until fully elapsed")
        void constrained() {
            Adaptation adaptation = Adaptation.builder().resourceConstrained(true).build();

            assertThat(telemetry.assessCompletion(adaptation, 0.95)).isEqualTo(Verdict.PENDING);
            assertThat(telemetry.assessCompletion(adaptation, 1.0)).isEqualTo(Verdict.CONFIRMED);
        }
    }
}
