package com.z254.horizon.pattern;

import com.z254.horizon.domain.model.Pattern;
import com.z254.horizon.domain.model.PatternObservation;
import com.z254.horizon.domain.model.PatternType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Evolution records and trajectory forecasts over a pattern's observation
 * history. Histories are ordered newest first.
 */
@Component
public class PatternEvolutionModel {

    static final int TRAJECTORY_WINDOW = 5;
    static final int PREDICTION_WINDOW = 10;
    static final int TRAJECTORY_POINTS = 5;
    static final int STABILITY_WINDOW = 10;
    static final double MUTATION_DELTA = 0.3;
    static final long STEP_MILLIS = 100;
    static final int ATTRACTOR_MIN_HISTORY = 10;

    public EvolutionRecord buildRecord(String patternId, List<PatternObservation> history) {
        return EvolutionRecord.builder()
                .patternId(patternId)
                .history(List.copyOf(history))
                .trajectory(trajectory(history))
                .mutations(mutations(history))
                .stability(stability(history))
                .build();
    }

    /**
     * Slope per sample over the five newest samples, positive when rising.
     * Drives the evolution record's trajectory.
     */
    public double trend(List<PatternObservation> history) {
        return slope(history, TRAJECTORY_WINDOW);
    }

    /**
     * Slope per sample over the ten newest samples. Drives forecasts.
     */
    public double predictionTrend(List<PatternObservation> history) {
        return slope(history, PREDICTION_WINDOW);
    }

    /**
     * {@code exp(-variance)} of the latest strengths, 1.0 with fewer than two samples.
     */
    public double stability(List<PatternObservation> history) {
        if (history.size() < 2) {
            return 1.0;
        }
        List<Double> strengths = history.subList(0, Math.min(STABILITY_WINDOW, history.size())).stream()
                .map(PatternObservation::getStrength)
                .toList();
        return Math.exp(-PatternStatistics.variance(strengths));
    }

    /**
     * Forecast a pattern's strength every 100ms up to the horizon.
     *
     * @param pattern the pattern to forecast
     * @param history observation history, possibly empty
     * @param horizon forecast horizon
     */
    public TrajectoryPrediction predict(Pattern pattern, List<PatternObservation> history, Duration horizon) {
        long horizonMs = Math.max(0, horizon.toMillis());
        long steps = horizonMs / STEP_MILLIS;
        double current = history.isEmpty() ? pattern.getStrength() : history.get(0).getStrength();
        double trend = predictionTrend(history);

        List<PredictedState> states = new ArrayList<>();
        for (long step = 1; step <= steps; step++) {
            double strength = PatternStatistics.clamp(current + trend * step * 0.1, 0.0, 1.0);
            states.add(new PredictedState(step, step * STEP_MILLIS, strength, Math.exp(-0.1 * step)));
        }

        double stability = history.isEmpty() ? 0.5 : stability(history);
        double depth = Math.min(history.size() / 100.0, 1.0);

        return TrajectoryPrediction.builder()
                .patternId(pattern.getId())
                .predictedStates(states)
                .confidence((stability + depth) / 2.0)
                .bifurcationPoints(bifurcations(current, horizonMs))
                .attractorStates(attractors(history))
                .build();
    }

    // ========== Private Helper Methods ==========

    private static double slope(List<PatternObservation> history, int windowSize) {
        if (history.size() < 2) {
            return 0.0;
        }
        List<PatternObservation> window = history.subList(0, Math.min(windowSize, history.size()));
        double newest = window.get(0).getStrength();
        double oldest = window.get(window.size() - 1).getStrength();
        return (newest - oldest) / window.size();
    }

    private List<Double> trajectory(List<PatternObservation> history) {
        if (history.size() < 2) {
            return List.of();
        }
        double newest = history.get(0).getStrength();
        double trend = trend(history);
        List<Double> projection = new ArrayList<>(TRAJECTORY_POINTS);
        for (int i = 1; i <= TRAJECTORY_POINTS; i++) {
            projection.add(PatternStatistics.clamp(newest + trend * i, 0.0, 1.0));
        }
        return projection;
    }

    private List<Mutation> mutations(List<PatternObservation> history) {
        List<Mutation> mutations = new ArrayList<>();
        for (int i = 0; i + 1 < history.size(); i++) {
            PatternObservation newer = history.get(i);
            PatternObservation older = history.get(i + 1);
            if (newer.getPatternType() != older.getPatternType()) {
                mutations.add(new Mutation(MutationKind.TYPE_CHANGE, older.getPatternType(),
                        newer.getPatternType(), newer.getStrength() - older.getStrength(), newer.getTimestamp()));
            } else if (Math.abs(newer.getStrength() - older.getStrength()) > MUTATION_DELTA) {
                mutations.add(new Mutation(MutationKind.STRENGTH_SHIFT, older.getPatternType(),
                        newer.getPatternType(), newer.getStrength() - older.getStrength(), newer.getTimestamp()));
            }
        }
        return mutations;
    }

    private List<BifurcationPoint> bifurcations(double strength, long horizonMs) {
        List<BifurcationPoint> points = new ArrayList<>();
        if (Math.abs(strength - 0.5) < 0.1) {
            points.add(new BifurcationPoint(BifurcationType.CRITICAL_THRESHOLD, horizonMs / 2, strength));
        }
        if (strength > 0.9 || strength < 0.1) {
            points.add(new BifurcationPoint(BifurcationType.EXTREME_VALUE, horizonMs / 4, strength));
        }
        return points;
    }

    private List<AttractorState> attractors(List<PatternObservation> history) {
        if (history.size() < ATTRACTOR_MIN_HISTORY) {
            return List.of();
        }
        // clusters are 0.1-wide strength buckets; an attractor sits at its cluster's mean
        Map<Long, List<Double>> clusters = new TreeMap<>();
        for (PatternObservation observation : history) {
            clusters.computeIfAbsent(Math.round(observation.getStrength() / 0.1), k -> new ArrayList<>())
                    .add(observation.getStrength());
        }
        List<AttractorState> attractors = new ArrayList<>();
        clusters.values().forEach(cluster -> {
            double value = PatternStatistics.mean(cluster);
            AttractorType type = value > 0.8 ? AttractorType.STRONG
                    : value < 0.2 ? AttractorType.WEAK : AttractorType.NEUTRAL;
            attractors.add(new AttractorState(value, type, cluster.size() / (double) history.size()));
        });
        return attractors;
    }

    // ========== Result Types ==========

    public enum MutationKind {
        TYPE_CHANGE, STRENGTH_SHIFT
    }

    public enum BifurcationType {
        CRITICAL_THRESHOLD, EXTREME_VALUE
    }

    public enum AttractorType {
        STRONG, NEUTRAL, WEAK
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EvolutionRecord {
        private String patternId;
        private List<PatternObservation> history;
        /** Projected strengths for the next points */
        private List<Double> trajectory;
        private List<Mutation> mutations;
        private double stability;
    }

    @Data
    @AllArgsConstructor
    public static class Mutation {
        private MutationKind kind;
        private PatternType fromType;
        private PatternType toType;
        private double strengthDelta;
        private Instant observedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrajectoryPrediction {
        private String patternId;
        private List<PredictedState> predictedStates;
        private double confidence;
        private List<BifurcationPoint> bifurcationPoints;
        private List<AttractorState> attractorStates;
    }

    @Data
    @AllArgsConstructor
    public static class PredictedState {
        private long step;
        private long offsetMs;
        private double strength;
        private double confidence;
    }

    @Data
    @AllArgsConstructor
    public static class BifurcationPoint {
        private BifurcationType type;
        private long atMs;
        private double strength;
    }

    @Data
    @AllArgsConstructor
    public static class AttractorState {
        private double value;
        private AttractorType type;
        private double basinSize;
    }
}
