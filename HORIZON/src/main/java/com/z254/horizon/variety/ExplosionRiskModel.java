package com.z254.horizon.variety;

import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.MitigationOption;
import com.z254.horizon.domain.model.SignalLevel;
import com.z254.horizon.domain.model.VarietyData;
import com.z254.horizon.domain.model.VarietyTrend;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Variety arithmetic: external variety, trend, explosion risk, absorption
 * capability and time to explosion. Stateless; history is passed in
 * chronological order.
 */
@Component
public class ExplosionRiskModel {

    static final int TREND_WINDOW = 10;
    static final int TREND_MIN_SAMPLES = 3;

    private final HorizonProperties.Variety config;

    public ExplosionRiskModel(HorizonProperties horizonProperties) {
        this.config = horizonProperties.getVariety();
    }

    /**
     * Weighted count of novelty indicators, amplified under superposition.
     */
    public double externalVariety(VarietyData data) {
        double base = 0.3 * data.getNovelPatterns().size()
                + 0.2 * data.getEmergentProperties().size()
                + 0.25 * data.getRecursivePotential().size()
                + 0.25 * data.getMetaSystemSeeds().size();
        return data.isQuantumSuperposition() ? base * 1.5 : base;
    }

    /**
     * Compare the older and newer halves of the latest readings.
     */
    public VarietyTrend trend(List<VarietySample> history) {
        if (history.size() < TREND_MIN_SAMPLES) {
            return VarietyTrend.STABLE;
        }
        List<VarietySample> recent = history.subList(Math.max(0, history.size() - TREND_WINDOW), history.size());
        int split = recent.size() / 2;
        double older = mean(recent.subList(0, split));
        double newer = mean(recent.subList(split, recent.size()));

        if (newer > older * 1.1) {
            return VarietyTrend.INCREASING;
        } else if (newer < older * 0.9) {
            return VarietyTrend.DECREASING;
        }
        return VarietyTrend.STABLE;
    }

    public double explosionRisk(double ratio, VarietyTrend trend, double absorptionRate) {
        double deficit = 1.0 - absorptionRate;
        return Math.min(1.0, ratio / config.getCriticalRatio() * trend.getRiskFactor() * (1.0 + deficit));
    }

    public double absorptionCapability(double absorptionRate, double currentVariety) {
        return absorptionRate * Math.max(0.1, 1.0 - currentVariety / 10.0);
    }

    /**
     * Zero below the cascade threshold, then quadratic up to 1.
     */
    public double cascadeProbability(double ratio) {
        double threshold = config.getCascadeThreshold();
        if (ratio <= threshold) {
            return 0.0;
        }
        double base = (ratio - threshold) / (1.0 - threshold);
        return Math.min(base * base, 1.0);
    }

    /**
     * Seconds until variety reaches the critical multiple of capacity, projected
     * from the two most recent readings.
     *
     * @return 0 when already reached, positive infinity when variety is not rising
     */
    public double timeToExplosionSeconds(List<VarietySample> history, double currentVariety, double capacity) {
        double remaining = capacity * config.getCriticalRatio() - currentVariety;
        if (remaining <= 0.0) {
            return 0.0;
        }
        if (history.size() < 2) {
            return Double.POSITIVE_INFINITY;
        }
        VarietySample latest = history.get(history.size() - 1);
        VarietySample previous = history.get(history.size() - 2);
        double delta = latest.variety() - previous.variety();
        if (delta <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        long elapsedMs = Math.max(1L, Duration.between(previous.timestamp(), latest.timestamp()).toMillis());
        double ratePerSecond = delta / (elapsedMs / 1000.0);
        return remaining / ratePerSecond;
    }

    public List<MitigationOption> mitigationOptions(double currentVariety, double capacity) {
        List<MitigationOption> options = new ArrayList<>();
        options.add(new MitigationOption(MitigationOption.Strategy.INCREASE_INTERNAL_VARIETY,
                0.7, SignalLevel.MEDIUM, MitigationOption.Timeframe.IMMEDIATE));
        options.add(new MitigationOption(MitigationOption.Strategy.FILTER_EXTERNAL_VARIETY,
                0.5, SignalLevel.LOW, MitigationOption.Timeframe.IMMEDIATE));
        if (currentVariety > capacity * 2.0) {
            options.add(new MitigationOption(MitigationOption.Strategy.SPAWN_META_SYSTEM,
                    0.9, SignalLevel.HIGH, MitigationOption.Timeframe.DELAYED));
        }
        return options;
    }

    private double mean(List<VarietySample> samples) {
        return samples.stream().mapToDouble(VarietySample::variety).average().orElse(0.0);
    }
}
