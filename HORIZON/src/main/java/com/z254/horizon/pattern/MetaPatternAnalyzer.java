package com.z254.horizon.pattern;

import com.z254.horizon.client.PolicyAuthorityClient.SystemEvolutionProposal;
import com.z254.horizon.domain.model.EvolutionType;
import com.z254.horizon.domain.model.Pattern;
import com.z254.horizon.domain.model.PatternType;
import com.z254.horizon.domain.model.Urgency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Whole-set scan for recursive, hierarchical, self-similar and universal
 * structure, and the structural evolution such structure suggests.
 */
@Component
public class MetaPatternAnalyzer {

    private final PatternCorrelator correlator;

    public MetaPatternAnalyzer(PatternCorrelator correlator) {
        this.correlator = correlator;
    }

    /**
     * Scan the pattern set.
     *
     * @param patterns the stored patterns
     * @param stabilityOf evolution stability per pattern id (1.0 for untracked patterns)
     */
    public MetaPatternScan scan(Collection<Pattern> patterns, ToDoubleFunction<String> stabilityOf) {
        List<Pattern> set = new ArrayList<>(patterns);
        MetaPatternScan scan = MetaPatternScan.builder()
                .recursiveStructures(recursiveStructures(set))
                .patternOfPatterns(patternOfPatterns(set))
                .emergentHierarchies(hierarchies(set))
                .selfSimilarScales(selfSimilarity(set))
                .universalPatterns(universalPatterns(set, stabilityOf))
                .build();
        scan.setEvolutionRecommended(suggestsEvolution(scan));
        return scan;
    }

    public boolean suggestsEvolution(MetaPatternScan scan) {
        return !scan.getRecursiveStructures().isEmpty()
                || scan.getEmergentHierarchies().getDepth() > 3
                || scan.getSelfSimilarScales().getIndex() > 0.8
                || scan.getUniversalPatterns().getUniversalityIndex() > 0.7;
    }

    /**
     * Build the evolution proposal for a scan, if the scan suggests one.
     */
    public Optional<SystemEvolutionProposal> evolutionProposal(MetaPatternScan scan, Instant now) {
        if (!suggestsEvolution(scan)) {
            return Optional.empty();
        }
        return Optional.of(new SystemEvolutionProposal(
                evolutionType(scan),
                evolutionUrgency(scan),
                scan.getEmergentHierarchies().getDepth(),
                scan.getRecursiveStructures().size(),
                scan.getSelfSimilarScales().getIndex(),
                scan.getUniversalPatterns().getUniversalityIndex(),
                now));
    }

    public EvolutionType evolutionType(MetaPatternScan scan) {
        if (!scan.getRecursiveStructures().isEmpty()) {
            return EvolutionType.RECURSIVE_EXPANSION;
        } else if (scan.getEmergentHierarchies().getDepth() > 3) {
            return EvolutionType.HIERARCHICAL_RESTRUCTURING;
        } else if (scan.getSelfSimilarScales().getIndex() > 0.8) {
            return EvolutionType.FRACTAL_EVOLUTION;
        } else if (scan.getUniversalPatterns().getUniversalityIndex() > 0.7) {
            return EvolutionType.UNIVERSAL_INTEGRATION;
        }
        return EvolutionType.ADAPTIVE_EVOLUTION;
    }

    public Urgency evolutionUrgency(MetaPatternScan scan) {
        int factors = 0;
        if (scan.getRecursiveStructures().size() > 5) {
            factors++;
        }
        if (scan.getEmergentHierarchies().getDepth() > 4) {
            factors++;
        }
        if (scan.getSelfSimilarScales().getIndex() > 0.9) {
            factors++;
        }
        if (scan.getUniversalPatterns().getUniversalityIndex() > 0.8) {
            factors++;
        }

        if (factors >= 3) {
            return Urgency.CRITICAL;
        } else if (factors >= 2) {
            return Urgency.HIGH;
        } else if (factors >= 1) {
            return Urgency.MEDIUM;
        }
        return Urgency.LOW;
    }

    // ========== Private Helper Methods ==========

    private List<RecursiveStructure> recursiveStructures(List<Pattern> set) {
        List<RecursiveStructure> structures = new ArrayList<>();
        for (Pattern parent : set) {
            for (Pattern child : set) {
                if (parent == child || parent.getPatternType() != child.getPatternType()) {
                    continue;
                }
                double scaleDelta = Math.abs(parent.getScale() - child.getScale());
                if (scaleDelta <= 0.3) {
                    continue;
                }
                double similarity = correlator.similarity(parent, child);
                if (similarity > 0.7) {
                    double ratio = child.getScale() == 0.0 ? 0.0 : parent.getScale() / child.getScale();
                    structures.add(new RecursiveStructure(parent.getId(), child.getId(),
                            parent.getPatternType(), similarity, ratio, Math.log(Math.abs(ratio) + 1.0)));
                }
            }
        }
        return structures;
    }

    private PatternOfPatterns patternOfPatterns(List<Pattern> set) {
        Map<PatternType, Long> distribution = set.stream()
                .collect(Collectors.groupingBy(Pattern::getPatternType,
                        () -> new EnumMap<>(PatternType.class), Collectors.counting()));
        PatternType dominant = distribution.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);

        List<Instant> times = set.stream()
                .map(Pattern::getTimestamp)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        List<Double> intervals = new ArrayList<>();
        for (int i = 1; i < times.size(); i++) {
            intervals.add((double) (times.get(i).toEpochMilli() - times.get(i - 1).toEpochMilli()));
        }
        double regularity = Math.exp(-PatternStatistics.variance(intervals) / 1_000_000.0);
        double complexity = Math.min((distribution.size() / 10.0 + set.size() / 100.0) / 2.0, 1.0);

        return new PatternOfPatterns(dominant, distribution, regularity, complexity);
    }

    private HierarchyAnalysis hierarchies(List<Pattern> set) {
        Map<HierarchyLevel, Long> levels = set.stream()
                .collect(Collectors.groupingBy(p -> HierarchyLevel.of(p.getStrength()),
                        () -> new EnumMap<>(HierarchyLevel.class), Collectors.counting()));
        List<Double> counts = levels.values().stream().map(Long::doubleValue).toList();
        double balance = Math.exp(-PatternStatistics.variance(counts) / 10.0);
        return new HierarchyAnalysis(levels, levels.size(), balance);
    }

    private SelfSimilarity selfSimilarity(List<Pattern> set) {
        Map<ScaleBand, List<Pattern>> byBand = new EnumMap<>(ScaleBand.class);
        for (Pattern p : set) {
            byBand.computeIfAbsent(ScaleBand.of(p.getStrength()), b -> new ArrayList<>()).add(p);
        }
        List<Pattern> micro = byBand.getOrDefault(ScaleBand.MICRO, List.of());
        List<Pattern> meso = byBand.getOrDefault(ScaleBand.MESO, List.of());
        List<Pattern> macro = byBand.getOrDefault(ScaleBand.MACRO, List.of());

        double microMeso = setSimilarity(micro, meso);
        double mesoMacro = setSimilarity(meso, macro);
        double microMacro = setSimilarity(micro, macro);
        double index = (microMeso + mesoMacro + microMacro) / 3.0;

        int bands = byBand.size();
        double fractalDimension = bands > 1 && set.size() > 1
                ? Math.log(set.size()) / Math.log(bands)
                : 1.0;

        Map<ScaleBand, Integer> distribution = new EnumMap<>(ScaleBand.class);
        byBand.forEach((band, members) -> distribution.put(band, members.size()));

        return SelfSimilarity.builder()
                .scaleDistribution(distribution)
                .microMeso(microMeso)
                .mesoMacro(mesoMacro)
                .microMacro(microMacro)
                .index(index)
                .selfSimilar(index > 0.7)
                .fractalDimension(fractalDimension)
                .build();
    }

    /**
     * Mean over pattern types of {@code 2·min(c1,c2)/(c1+c2)}; 0 when either set is empty.
     */
    double setSimilarity(List<Pattern> first, List<Pattern> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Map<PatternType, Long> c1 = first.stream()
                .collect(Collectors.groupingBy(Pattern::getPatternType, Collectors.counting()));
        Map<PatternType, Long> c2 = second.stream()
                .collect(Collectors.groupingBy(Pattern::getPatternType, Collectors.counting()));
        Set<PatternType> types = EnumSet.noneOf(PatternType.class);
        types.addAll(c1.keySet());
        types.addAll(c2.keySet());

        double sum = 0.0;
        for (PatternType type : types) {
            long a = c1.getOrDefault(type, 0L);
            long b = c2.getOrDefault(type, 0L);
            sum += 2.0 * Math.min(a, b) / (a + b);
        }
        return sum / types.size();
    }

    private UniversalPatterns universalPatterns(List<Pattern> set, ToDoubleFunction<String> stabilityOf) {
        List<String> universal = set.stream()
                .filter(p -> p.getStrength() > 0.6 && stabilityOf.applyAsDouble(p.getId()) > 0.7)
                .map(Pattern::getId)
                .toList();
        double index = universal.size() / (double) Math.max(set.size(), 1);
        return new UniversalPatterns(universal, index);
    }

    // ========== Result Types ==========

    public enum HierarchyLevel {
        DOMINANT, INTERMEDIATE, SUBORDINATE, WEAK;

        public static HierarchyLevel of(double strength) {
            if (strength > 0.8) {
                return DOMINANT;
            } else if (strength > 0.5) {
                return INTERMEDIATE;
            } else if (strength > 0.2) {
                return SUBORDINATE;
            }
            return WEAK;
        }
    }

    public enum ScaleBand {
        MICRO, MESO, MACRO;

        public static ScaleBand of(double strength) {
            if (strength > 0.7) {
                return MACRO;
            } else if (strength > 0.3) {
                return MESO;
            }
            return MICRO;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetaPatternScan {
        private List<RecursiveStructure> recursiveStructures;
        private PatternOfPatterns patternOfPatterns;
        private HierarchyAnalysis emergentHierarchies;
        private SelfSimilarity selfSimilarScales;
        private UniversalPatterns universalPatterns;
        private boolean evolutionRecommended;
    }

    @Data
    @AllArgsConstructor
    public static class RecursiveStructure {
        private String parentPatternId;
        private String childPatternId;
        private PatternType patternType;
        private double similarity;
        private double scaleRatio;
        private double recursionDepth;
    }

    @Data
    @AllArgsConstructor
    public static class PatternOfPatterns {
        private PatternType dominantType;
        private Map<PatternType, Long> distribution;
        private double metaRegularity;
        private double metaComplexity;
    }

    @Data
    @AllArgsConstructor
    public static class HierarchyAnalysis {
        private Map<HierarchyLevel, Long> levels;
        private int depth;
        private double balance;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SelfSimilarity {
        private Map<ScaleBand, Integer> scaleDistribution;
        private double microMeso;
        private double mesoMacro;
        private double microMacro;
        private double index;
        private boolean selfSimilar;
        private double fractalDimension;
    }

    @Data
    @AllArgsConstructor
    public static class UniversalPatterns {
        private List<String> patternIds;
        private double universalityIndex;
    }
}
