package com.z254.horizon.variety;

import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.MitigationOption;
import com.z254.horizon.domain.model.VarietyData;
import com.z254.horizon.domain.model.VarietyTrend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExplosionRiskModelTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ExplosionRiskModel model;

    @BeforeEach
    void setUp() {
        model = new ExplosionRiskModel(new HorizonProperties());
    }

    private static List<VarietySample> samples(double... levels) {
        List<VarietySample> samples = new ArrayList<>();
        for (int i = 0; i < levels.length; i++) {
            samples.add(new VarietySample(T0.plusSeconds(i), levels[i]));
        }
        return samples;
    }

    @Nested
    @DisplayName("External variety")
    class ExternalVarietyTests {

        private VarietyData.VarietyDataBuilder indicators() {
            return VarietyData.builder()
                    .novelPatterns(Map.of("a", 1, "b", 2))
                    .emergentProperties(List.of("self-repair"))
                    .recursivePotential(List.of("r1", "r2"))
                    .metaSystemSeeds(Map.of("seed", true));
        }

        @Test
        @DisplayName("should weight each indicator family")
        void weighted() {
            assertThat(model.externalVariety(indicators().build())).isCloseTo(1.55, within(1e-9));
        }

        @Test
        @DisplayName("should amplify under superposition")
        void superposition() {
            assertThat(model.externalVariety(indicators().quantumSuperposition(true).build()))
                    .isCloseTo(2.325, within(1e-9));
        }

        @Test
        @DisplayName("should be zero without indicators")
        void empty() {
            assertThat(model.externalVariety(VarietyData.builder().build())).isZero();
        }
    }

    @Nested
    @DisplayName("Trend")
    class TrendTests {

        @Test
        @DisplayName("should be stable with fewer than three readings")
        void tooFew() {
            assertThat(model.trend(samples(1.0, 5.0))).isEqualTo(VarietyTrend.STABLE);
        }

        @Test
        @DisplayName("should compare the older half with the newer half")
        void halves() {
            assertThat(model.trend(samples(1.0, 1.0, 1.0, 2.0, 2.0, 2.0))).isEqualTo(VarietyTrend.INCREASING);
            assertThat(model.trend(samples(2.0, 2.0, 2.0, 1.0, 1.0, 1.0))).isEqualTo(VarietyTrend.DECREASING);
            assertThat(model.trend(samples(1.0, 1.05, 1.0, 1.05))).isEqualTo(VarietyTrend.STABLE);
        }

        @Test
        @DisplayName("should only look at the ten latest readings")
        void window() {
            assertThat(model.trend(samples(100.0, 100.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0)))
                    .isEqualTo(VarietyTrend.STABLE);
        }
    }

    @Nested
    @DisplayName("Risk and capability")
    class RiskTests {

        @Test
        @DisplayName("should saturate at 1.0")
        void saturates() {
            assertThat(model.explosionRisk(2.5, VarietyTrend.STABLE, 0.7)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should scale with ratio, trend and absorption deficit")
        void formula() {
            assertThat(model.explosionRisk(1.0, VarietyTrend.STABLE, 1.0)).isCloseTo(1.0 / 3.0, within(1e-9));
            assertThat(model.explosionRisk(1.0, VarietyTrend.INCREASING, 0.7)).isCloseTo(0.52, within(1e-9));
        }

        @Test
        @DisplayName("should never decrease as the ratio grows")
        void monotonicInRatio() {
            double previous = 0.0;
            for (double ratio = 0.0; ratio <= 5.0; ratio += 0.25) {
                double risk = model.explosionRisk(ratio, VarietyTrend.DECREASING, 0.6);
                assertThat(risk).isGreaterThanOrEqualTo(previous).isBetween(0.0, 1.0);
                previous = risk;
            }
        }

        @Test
        @DisplayName("should floor absorption capability at a tenth of the rate")
        void capability() {
            assertThat(model.absorptionCapability(0.7, 2.5)).isCloseTo(0.525, within(1e-9));
            assertThat(model.absorptionCapability(0.7, 20.0)).isCloseTo(0.07, within(1e-9));
        }

        @Test
        @DisplayName("should only report cascade probability above the threshold")
        void cascadeProbability() {
            assertThat(model.cascadeProbability(0.75)).isZero();
            assertThat(model.cascadeProbability(0.875)).isCloseTo(0.25, within(1e-9));
            assertThat(model.cascadeProbability(1.0)).isCloseTo(1.0, within(1e-9));
            assertThat(model.cascadeProbability(4.0)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Time to explosion")
    class TimeToExplosionTests {

        @Test
        @DisplayName("should be zero once the critical level is reached")
        void alreadyCritical() {
            assertThat(model.timeToExplosionSeconds(samples(4.0, 3.0), 3.5, 1.0)).isZero();
        }

        @Test
        @DisplayName("should project the latest rate of increase")
        void projection() {
            List<VarietySample> history = List.of(
                    new VarietySample(T0, 1.0),
                    new VarietySample(T0.plusSeconds(2), 2.0));

            assertThat(model.timeToExplosionSeconds(history, 2.0, 1.0)).isCloseTo(2.0, within(1e-9));
        }

        @Test
        @DisplayName("should be infinite when variety is not rising")
        void notRising() {
            assertThat(model.timeToExplosionSeconds(samples(2.0, 1.5), 1.5, 1.0)).isInfinite();
            assertThat(model.timeToExplosionSeconds(samples(1.5), 1.5, 1.0)).isInfinite();
        }

        @Test
        @DisplayName("should treat simultaneous readings as one millisecond apart")
        void simultaneous() {
            List<VarietySample> history = List.of(new VarietySample(T0, 1.0), new VarietySample(T0, 2.0));

            assertThat(model.timeToExplosionSeconds(history, 2.0, 1.0)).isCloseTo(0.001, within(1e-9));
        }
    }

    @Test
    @DisplayName("should offer a meta-system only above twice capacity")
    void mitigation() {
        assertThat(model.mitigationOptions(1.5, 1.0)).extracting(MitigationOption::getStrategy)
                .containsExactly(MitigationOption.Strategy.INCREASE_INTERNAL_VARIETY,
                        MitigationOption.Strategy.FILTER_EXTERNAL_VARIETY);
        assertThat(model.mitigationOptions(2.5, 1.0)).extracting(MitigationOption::getStrategy)
                .contains(MitigationOption.Strategy.SPAWN_META_SYSTEM);
    }
}
