package com.z254.horizon.pattern;

import com.z254.horizon.domain.model.Pattern;
import com.z254.horizon.domain.model.PatternType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Characterizes how a set of patterns interacts and whether it shows
 * emergent, self-organizing behaviour.
 */
@Component
public class EmergenceAnalyzer {

    static final double SIGNIFICANCE_THRESHOLD = 0.7;

    private final PatternCorrelator correlator;

    public EmergenceAnalyzer(PatternCorrelator correlator) {
        this.correlator = correlator;
    }

    /**
     * Analyze a pattern set.
     *
     * @param patterns the patterns to analyze
     * @param historicalAverageSize mean number of patterns accepted per past detection cycle
     * @return the analysis; an empty set yields level NONE
     */
    public EmergenceAnalysis analyze(Collection<Pattern> patterns, double historicalAverageSize) {
        List<Pattern> set = new ArrayList<>(patterns);
        double meanEmergence = set.stream().mapToDouble(Pattern::getEmergenceScore).average().orElse(0.0);

        return EmergenceAnalysis.builder()
                .emergenceLevel(EmergenceLevel.of(set.isEmpty() ? null : meanEmergence))
                .meanEmergence(meanEmergence)
                .patternInteractions(interactions(set))
                .criticalPoints(criticalPoints(set))
                .phaseTransitions(phaseTransitions(set.size(), historicalAverageSize))
                .selfOrganization(set.isEmpty() ? 0.0 : selfOrganization(set))
                .complexityMeasure(complexity(set))
                .predictability(predictability(set))
                .significant(!set.isEmpty() && meanEmergence > SIGNIFICANCE_THRESHOLD)
                .build();
    }

    /**
     * Classify a pattern pair: reinforcing, inhibiting, modulating or neutral, in that precedence.
     */
    public InteractionType classify(Pattern first, Pattern second) {
        boolean sameType = first.getPatternType() == second.getPatternType();
        if (sameType && first.getStrength() > 0.5 && second.getStrength() > 0.5) {
            return InteractionType.REINFORCING;
        }
        if (!sameType && (first.getStrength() > 0.7 || second.getStrength() > 0.7)) {
            return InteractionType.INHIBITING;
        }
        if (Math.abs(first.getStrength() - second.getStrength()) > 0.3) {
            return InteractionType.MODULATING;
        }
        return InteractionType.NEUTRAL;
    }

    // ========== Private Helper Methods ==========

    private InteractionSummary interactions(List<Pattern> set) {
        List<PatternInteraction> network = new ArrayList<>();
        for (int i = 0; i < set.size(); i++) {
            for (int j = i + 1; j < set.size(); j++) {
                Pattern a = set.get(i);
                Pattern b = set.get(j);
                double strength = (a.getStrength() + b.getStrength()) / 2.0 * correlator.correlation(a, b);
                network.add(new PatternInteraction(a.getId(), b.getId(), classify(a, b), strength));
            }
        }
        Map<InteractionType, Long> byType = network.stream()
                .collect(Collectors.groupingBy(PatternInteraction::getType,
                        () -> new EnumMap<>(InteractionType.class), Collectors.counting()));
        int strong = (int) network.stream().filter(n -> n.getStrength() > 0.7).count();
        return new InteractionSummary(network.size(), strong, network, byType);
    }

    private List<CriticalPoint> criticalPoints(List<Pattern> set) {
        List<CriticalPoint> points = new ArrayList<>();
        for (Pattern p : set) {
            if (p.getStrength() > 0.8 || p.getEmergenceScore() > 0.7) {
                CriticalityType kind;
                if (p.getEmergenceScore() > 0.9) {
                    kind = CriticalityType.EMERGENCE_CRITICAL;
                } else if (p.getStrength() > 0.9) {
                    kind = CriticalityType.STRENGTH_CRITICAL;
                } else {
                    kind = CriticalityType.THRESHOLD_CRITICAL;
                }
                double criticality = (p.getStrength() + p.getEmergenceScore()) / 2.0;
                points.add(new CriticalPoint(p.getId(), criticality, kind));
            }
        }
        return points;
    }

    private List<PhaseTransition> phaseTransitions(int currentSize, double historicalAverageSize) {
        if (historicalAverageSize <= 0.0 || currentSize <= historicalAverageSize * 1.5) {
            return List.of();
        }
        Phase next = currentSize > 20 ? Phase.PRUNING : Phase.CONSOLIDATION;
        double probability = Math.min(1.0, 0.2 * currentSize);
        return List.of(new PhaseTransition(Phase.GROWTH, probability, next));
    }

    private double selfOrganization(List<Pattern> set) {
        List<Double> strengths = set.stream().map(Pattern::getStrength).toList();
        double order = 1.0 - Math.min(PatternStatistics.variance(strengths), 1.0);
        long types = set.stream().map(Pattern::getPatternType).distinct().count();
        double hierarchy = types >= 4 ? 0.8 : 0.3;
        return (order + hierarchy) / 2.0;
    }

    private double complexity(List<Pattern> set) {
        if (set.isEmpty()) {
            return 0.0;
        }
        Set<PatternType> types = EnumSet.noneOf(PatternType.class);
        set.forEach(p -> types.add(p.getPatternType()));
        return types.size() / (double) set.size();
    }

    private double predictability(List<Pattern> set) {
        if (set.isEmpty()) {
            return 1.0;
        }
        return set.stream()
                .map(Pattern::structuralRegularity)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .average()
                .orElse(0.5);
    }

    // ========== Result Types ==========

    public enum EmergenceLevel {
        NONE, MINIMAL, LOW, MEDIUM, HIGH;

        /**
         * Bucket a mean emergence score; null means there was nothing to score.
         */
        public static EmergenceLevel of(Double meanEmergence) {
            if (meanEmergence == null) {
                return NONE;
            } else if (meanEmergence > 0.8) {
                return HIGH;
            } else if (meanEmergence > 0.5) {
                return MEDIUM;
            } else if (meanEmergence > 0.2) {
                return LOW;
            }
            return MINIMAL;
        }
    }

    public enum InteractionType {
        REINFORCING, INHIBITING, MODULATING, NEUTRAL
    }

    public enum CriticalityType {
        EMERGENCE_CRITICAL, STRENGTH_CRITICAL, THRESHOLD_CRITICAL
    }

    public enum Phase {
        GROWTH, CONSOLIDATION, PRUNING
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmergenceAnalysis {
        private EmergenceLevel emergenceLevel;
        private double meanEmergence;
        private InteractionSummary patternInteractions;
        private List<CriticalPoint> criticalPoints;
        private List<PhaseTransition> phaseTransitions;
        private double selfOrganization;
        private double complexityMeasure;
        private double predictability;
        private boolean significant;
    }

    @Data
    @AllArgsConstructor
    public static class PatternInteraction {
        private String firstPatternId;
        private String secondPatternId;
        private InteractionType type;
        private double strength;
    }

    @Data
    @AllArgsConstructor
    public static class InteractionSummary {
        private int total;
        private int strong;
        private List<PatternInteraction> network;
        private Map<InteractionType, Long> byType;
    }

    @Data
    @AllArgsConstructor
    public static class CriticalPoint {
        private String patternId;
        private double criticality;
        private CriticalityType kind;
    }

    @Data
    @AllArgsConstructor
    public static class PhaseTransition {
        private Phase phase;
        private double probability;
        private Phase nextPhase;
    }
}
