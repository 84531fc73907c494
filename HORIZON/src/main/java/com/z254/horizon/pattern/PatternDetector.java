package com.z254.horizon.pattern;

import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.PolicyAuthorityClient.PatternEmergenceNotice;
import com.z254.horizon.client.PolicyAuthorityClient.SystemEvolutionProposal;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.exception.SignalValidationException;
import com.z254.horizon.domain.model.DataStream;
import com.z254.horizon.domain.model.DetectionResult;
import com.z254.horizon.domain.model.MetaPattern;
import com.z254.horizon.domain.model.MetaType;
import com.z254.horizon.domain.model.Pattern;
import com.z254.horizon.domain.model.PatternEdge;
import com.z254.horizon.domain.model.PatternGraph;
import com.z254.horizon.domain.model.PatternObservation;
import com.z254.horizon.domain.model.PatternType;
import com.z254.horizon.domain.model.SignalSnapshot;
import com.z254.horizon.kafka.IntelligenceEventProducer;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.observability.HorizonStructuredLogger.PatternEventType;
import com.z254.horizon.pattern.EmergenceAnalyzer.EmergenceAnalysis;
import com.z254.horizon.pattern.EmergenceAnalyzer.EmergenceLevel;
import com.z254.horizon.pattern.MetaPatternAnalyzer.MetaPatternScan;
import com.z254.horizon.pattern.PatternEvolutionModel.EvolutionRecord;
import com.z254.horizon.pattern.PatternEvolutionModel.TrajectoryPrediction;
import com.z254.horizon.runtime.ComponentMailbox;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Pattern detection component.
 * <p>
 * Owns the stored pattern set, the meta-patterns between stored patterns, the
 * pattern relationship graph and each pattern's observation history. All state
 * is confined to the component's mailbox; callers interact through
 * {@link Mono} replies or fire-and-forget notifications.
 * <p>
 * Detection cycle:
 * <ol>
 *     <li>Candidates are built from the stream (normalize, segment, extract, cluster)</li>
 *     <li>A candidate similar to no stored pattern above the emergence threshold is
 *     accepted; otherwise it is recorded as an observation of the closest stored pattern</li>
 *     <li>Highly correlated pairs form meta-patterns; correlated pairs are linked in the graph</li>
 * </ol>
 */
@Slf4j
@Service
public class PatternDetector {

    private final PatternFactory patternFactory;
    private final PatternCorrelator correlator;
    private final EmergenceAnalyzer emergenceAnalyzer;
    private final PatternEvolutionModel evolutionModel;
    private final MetaPatternAnalyzer metaPatternAnalyzer;
    private final PolicyAuthorityClient policyAuthority;
    private final IntelligenceEventProducer eventProducer;
    private final HorizonMetrics metrics;
    private final HorizonStructuredLogger structuredLogger;
    private final HorizonProperties.Pattern config;
    private final Clock clock;
    private final ComponentMailbox mailbox;

    // Mailbox-confined state
    private final LinkedHashMap<String, Pattern> patterns = new LinkedHashMap<>();
    private final Map<String, MetaPattern> metaPatterns = new LinkedHashMap<>();
    private final Set<String> graphNodes = new LinkedHashSet<>();
    private final List<PatternEdge> graphEdges = new ArrayList<>();
    private final Map<String, Deque<PatternObservation>> observations = new HashMap<>();
    private final Map<String, EvolutionRecord> evolutionRecords = new HashMap<>();
    private final Deque<EmergenceEvent> emergenceEvents = new ArrayDeque<>();
    private final Deque<Integer> cycleSizes = new ArrayDeque<>();
    private final Deque<SignalSnapshot> inputBuffer = new ArrayDeque<>();
    private DetectionMetrics detectionMetrics = DetectionMetrics.initial();

    public PatternDetector(PatternFactory patternFactory,
                           PatternCorrelator correlator,
                           EmergenceAnalyzer emergenceAnalyzer,
                           PatternEvolutionModel evolutionModel,
                           MetaPatternAnalyzer metaPatternAnalyzer,
                           PolicyAuthorityClient policyAuthority,
                           IntelligenceEventProducer eventProducer,
                           HorizonMetrics metrics,
                           HorizonStructuredLogger structuredLogger,
                           HorizonProperties horizonProperties,
                           Clock clock) {
        this.patternFactory = patternFactory;
        this.correlator = correlator;
        this.emergenceAnalyzer = emergenceAnalyzer;
        this.evolutionModel = evolutionModel;
        this.metaPatternAnalyzer = metaPatternAnalyzer;
        this.policyAuthority = policyAuthority;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = horizonProperties.getPattern();
        this.clock = clock;
        this.mailbox = new ComponentMailbox("pattern-detector");
    }

    @PostConstruct
    public void start() {
        mailbox.every("analysis-tick", config.getAnalysisInterval(), this::drainInputBuffer);
        log.info("Pattern detector started: analysisInterval={}", config.getAnalysisInterval());
    }

    @PreDestroy
    public void stop() {
        mailbox.shutdown();
    }

    // ========== Operations ==========

    /**
     * Run a detection cycle over a data stream.
     *
     * @return the accepted patterns and new meta-patterns; fails with
     * {@link SignalValidationException} for a malformed stream
     */
    public Mono<DetectionResult> detectPatterns(DataStream stream) {
        return mailbox.request("detect-patterns", () -> detect(stream));
    }

    /**
     * Run a detection cycle over a scanned snapshot.
     */
    public Mono<DetectionResult> detectPatterns(SignalSnapshot snapshot) {
        return mailbox.request("detect-patterns", () -> detect(toStream(snapshot)));
    }

    public Mono<EmergenceAnalysis> analyzeEmergence(Collection<Pattern> patternSet) {
        List<Pattern> set = List.copyOf(patternSet);
        return mailbox.request("analyze-emergence", () -> analyze(set));
    }

    /**
     * Evolution record of a stored pattern, empty for an unknown id.
     */
    public Mono<Optional<EvolutionRecord>> trackEvolution(String patternId) {
        return mailbox.request("track-evolution", () -> {
            Deque<PatternObservation> history = observations.get(patternId);
            if (history == null) {
                return Optional.empty();
            }
            EvolutionRecord record = evolutionModel.buildRecord(patternId, new ArrayList<>(history));
            evolutionRecords.put(patternId, record);
            return Optional.of(record);
        });
    }

    public Mono<TrajectoryPrediction> predictPatternTrajectory(Pattern pattern, Duration horizon) {
        return mailbox.request("predict-trajectory", () ->
                evolutionModel.predict(pattern, historyOf(pattern.getId()), horizon));
    }

    /**
     * Scan the stored pattern set for meta-structure. A scan that suggests a
     * structural evolution is proposed to the policy authority.
     */
    public Mono<MetaPatternScan> identifyMetaPatterns() {
        return mailbox.request("identify-meta-patterns", this::scanMetaStructure);
    }

    public Mono<PatternState> getPatternState() {
        return mailbox.request("pattern-state", this::snapshotState);
    }

    /**
     * Queue a snapshot for the next analysis tick.
     */
    public void submitForAnalysis(SignalSnapshot snapshot) {
        mailbox.tell("submit-for-analysis", () -> inputBuffer.addLast(snapshot));
    }

    // ========== Detection ==========

    private DetectionResult detect(DataStream stream) {
        Timer.Sample sample = metrics.startDetectionTimer();
        Instant now = clock.instant();

        List<Pattern> candidates;
        try {
            candidates = patternFactory.candidates(stream, now);
        } catch (SignalValidationException e) {
            structuredLogger.logPatternEvent(null, PatternEventType.VALIDATION_FAILED,
                    "Rejected malformed data stream", Map.of("field", e.getField(), "error", e.getMessage()));
            throw e;
        }

        List<Pattern> stored = new ArrayList<>(patterns.values());
        List<Pattern> accepted = new ArrayList<>();
        for (Pattern detected : candidates) {
            Pattern closest = null;
            double maxSimilarity = 0.0;
            for (Pattern existing : stored) {
                double similarity = correlator.similarity(detected, existing);
                if (closest == null || similarity > maxSimilarity) {
                    closest = existing;
                    maxSimilarity = similarity;
                }
            }
            double novelty = closest == null ? 1.0 : 1.0 - maxSimilarity;
            Pattern candidate = detected.toBuilder()
                    .emergenceScore(0.5 * detected.getStrength() + 0.5 * novelty)
                    .build();

            if (closest == null || maxSimilarity <= config.getEmergenceSimilarityThreshold()) {
                accepted.add(candidate);
            } else {
                observe(closest, candidate, now);
            }
        }

        List<MetaPattern> newMetas = formMetaPatterns(stored, accepted, now);
        linkGraph(stored, accepted);
        accepted.forEach(this::store);
        evictOverflow();

        double score = accepted.stream().mapToDouble(Pattern::getEmergenceScore).average().orElse(0.0);
        recordCycle(accepted.size(), newMetas.size());

        double graphComplexity = graph().complexity();
        metrics.recordDetection(sample, candidates.size(), accepted.size(), newMetas.size(), score, patterns.size());
        structuredLogger.logPatternEvent(null, PatternEventType.DETECTION_COMPLETED,
                "Detection cycle completed", Map.of(
                        "candidates", candidates.size(),
                        "emergent", accepted.size(),
                        "metaPatterns", newMetas.size(),
                        "emergenceScore", score,
                        "graphComplexity", graphComplexity));
        accepted.forEach(p -> structuredLogger.logPatternEvent(p.getId(), PatternEventType.EMERGENT_DETECTED,
                "Emergent pattern detected", Map.of(
                        "type", p.getPatternType(),
                        "strength", p.getStrength(),
                        "emergenceScore", p.getEmergenceScore())));

        eventProducer.emitEmergentPatterns(accepted, newMetas, score);
        if (accepted.size() > config.getEmergentNotificationThreshold()
                || newMetas.size() > config.getMetaNotificationThreshold()) {
            escalateEmergence(accepted, newMetas, score, now);
        }

        return DetectionResult.builder()
                .patterns(accepted)
                .metaPatterns(newMetas)
                .emergenceScore(score)
                .graphComplexity(graphComplexity)
                .build();
    }

    private DataStream toStream(SignalSnapshot snapshot) {
        try {
            return DataStream.fromSnapshot(snapshot);
        } catch (SignalValidationException e) {
            structuredLogger.logPatternEvent(null, PatternEventType.VALIDATION_FAILED,
                    "Rejected malformed snapshot", Map.of("field", e.getField(), "error", e.getMessage()));
            throw e;
        }
    }

    private void observe(Pattern target, Pattern candidate, Instant now) {
        Deque<PatternObservation> history = observations.computeIfAbsent(target.getId(), id -> new ArrayDeque<>());
        history.addFirst(new PatternObservation(target.getId(), candidate.getPatternType(),
                candidate.getStrength(), now));
        while (history.size() > config.getEvolutionHistorySize()) {
            history.removeLast();
        }
    }

    private List<MetaPattern> formMetaPatterns(List<Pattern> stored, List<Pattern> accepted, Instant now) {
        List<MetaPattern> formed = new ArrayList<>();
        List<Pattern> pool = new ArrayList<>(stored);
        for (Pattern pattern : accepted) {
            for (Pattern other : pool) {
                String key = pairKey(pattern.getId(), other.getId());
                if (metaPatterns.containsKey(key)
                        || correlator.correlation(pattern, other) <= config.getMetaCorrelationThreshold()) {
                    continue;
                }
                MetaPattern meta = metaPatternOf(pattern, other, now);
                metaPatterns.put(key, meta);
                formed.add(meta);
                structuredLogger.logPatternEvent(meta.getId(), PatternEventType.META_PATTERN_FORMED,
                        "Meta-pattern formed", Map.of("metaType", meta.getMetaType(),
                                "components", meta.getComponentPatternIds()));
            }
            pool.add(pattern);
        }
        return formed;
    }

    private MetaPattern metaPatternOf(Pattern first, Pattern second, Instant now) {
        return MetaPattern.builder()
                .id(UUID.randomUUID().toString())
                .componentPatternIds(List.of(first.getId(), second.getId()))
                .metaType(MetaType.forPair(first.getPatternType(), second.getPatternType()))
                .strength((first.getStrength() + second.getStrength()) / 2.0 * MetaPattern.STRENGTH_FACTOR)
                .timestamp(now)
                .build();
    }

    private void linkGraph(List<Pattern> stored, List<Pattern> accepted) {
        List<Pattern> pool = new ArrayList<>(stored);
        for (Pattern pattern : accepted) {
            graphNodes.add(pattern.getId());
            for (Pattern other : pool) {
                double correlation = correlator.correlation(pattern, other);
                if (correlation > config.getEdgeCorrelationThreshold()) {
                    graphEdges.add(new PatternEdge(pattern.getId(), other.getId(), correlation));
                }
            }
            pool.add(pattern);
        }
    }

    private void store(Pattern pattern) {
        patterns.put(pattern.getId(), pattern);
        Deque<PatternObservation> history = new ArrayDeque<>();
        history.addFirst(PatternObservation.of(pattern));
        observations.put(pattern.getId(), history);
    }

    /**
     * Drop the oldest patterns beyond the history limit, together with
     * everything that refers to them.
     */
    private void evictOverflow() {
        Iterator<Map.Entry<String, Pattern>> it = patterns.entrySet().iterator();
        while (patterns.size() > config.getHistorySize() && it.hasNext()) {
            String evicted = it.next().getKey();
            it.remove();
            observations.remove(evicted);
            evolutionRecords.remove(evicted);
            graphNodes.remove(evicted);
            graphEdges.removeIf(e -> e.source().equals(evicted) || e.target().equals(evicted));
            metaPatterns.values().removeIf(m -> m.getComponentPatternIds().contains(evicted));
            log.debug("Evicted pattern {} beyond history limit {}", evicted, config.getHistorySize());
        }
    }

    private void recordCycle(int acceptedCount, int metaCount) {
        detectionMetrics = new DetectionMetrics(
                detectionMetrics.getTotalDetected() + acceptedCount,
                0.9 * detectionMetrics.getEmergenceRate() + 0.1 * acceptedCount,
                detectionMetrics.getMetaPatternCount() + metaCount);
        cycleSizes.addLast(acceptedCount);
        while (cycleSizes.size() > config.getEvolutionHistorySize()) {
            cycleSizes.removeFirst();
        }
    }

    private void escalateEmergence(List<Pattern> accepted, List<MetaPattern> metas, double score, Instant now) {
        PatternEmergenceNotice notice = new PatternEmergenceNotice(accepted.size(), metas.size(), score,
                accepted.stream().map(Pattern::getId).toList(), now);
        structuredLogger.logPatternEvent(null, PatternEventType.EMERGENCE_ESCALATED,
                "Unusual emergence reported to policy authority",
                Map.of("emergent", accepted.size(), "metaPatterns", metas.size()));
        policyAuthority.handlePatternEmergence(notice)
                .subscribe(v -> { }, e -> log.warn("Pattern emergence notice failed: {}", e.getMessage()));
    }

    private void drainInputBuffer() {
        while (!inputBuffer.isEmpty()) {
            SignalSnapshot snapshot = inputBuffer.pollFirst();
            try {
                detect(toStream(snapshot));
            } catch (SignalValidationException e) {
                log.warn("Dropped buffered snapshot: {}", e.getMessage());
            }
        }
    }

    // ========== Analysis ==========

    private EmergenceAnalysis analyze(List<Pattern> set) {
        double historicalAverage = cycleSizes.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        EmergenceAnalysis analysis = emergenceAnalyzer.analyze(set, historicalAverage);
        if (analysis.isSignificant()) {
            emergenceEvents.addLast(new EmergenceEvent(clock.instant(), analysis.getEmergenceLevel(),
                    analysis.getMeanEmergence(), set.size()));
            while (emergenceEvents.size() > config.getEmergenceEventLimit()) {
                emergenceEvents.removeFirst();
            }
            structuredLogger.logPatternEvent(null, PatternEventType.EMERGENCE_SIGNIFICANT,
                    "Significant emergence observed", Map.of(
                            "level", analysis.getEmergenceLevel(),
                            "meanEmergence", analysis.getMeanEmergence(),
                            "patterns", set.size()));
        }
        return analysis;
    }

    private MetaPatternScan scanMetaStructure() {
        MetaPatternScan scan = metaPatternAnalyzer.scan(patterns.values(),
                id -> evolutionModel.stability(historyOf(id)));
        metaPatternAnalyzer.evolutionProposal(scan, clock.instant()).ifPresent(this::proposeEvolution);
        return scan;
    }

    private void proposeEvolution(SystemEvolutionProposal proposal) {
        structuredLogger.logPatternEvent(null, PatternEventType.EVOLUTION_PROPOSED,
                "System evolution proposed", Map.of(
                        "evolutionType", proposal.evolutionType(),
                        "urgency", proposal.urgency()));
        policyAuthority.proposeSystemEvolution(proposal)
                .subscribe(v -> { }, e -> log.warn("System evolution proposal failed: {}", e.getMessage()));
    }

    private PatternState snapshotState() {
        Map<PatternType, Long> byType = new EnumMap<>(PatternType.class);
        patterns.values().forEach(p -> byType.merge(p.getPatternType(), 1L, Long::sum));
        long evolving = observations.values().stream().filter(h -> h.size() > 1).count();
        PatternGraph graph = graph();
        return PatternState.builder()
                .patternCount(patterns.size())
                .patternsByType(byType)
                .metaPatternCount(metaPatterns.size())
                .graphNodes(graph.nodes().size())
                .graphEdges(graph.edges().size())
                .graphComplexity(graph.complexity())
                .evolvingPatterns((int) evolving)
                .emergenceEvents(emergenceEvents.size())
                .metrics(detectionMetrics)
                .bufferSize(inputBuffer.size())
                .build();
    }

    // ========== Private Helper Methods ==========

    private List<PatternObservation> historyOf(String patternId) {
        Deque<PatternObservation> history = observations.get(patternId);
        return history == null ? List.of() : new ArrayList<>(history);
    }

    private PatternGraph graph() {
        return new PatternGraph(Set.copyOf(graphNodes), List.copyOf(graphEdges));
    }

    static String pairKey(String first, String second) {
        return first.compareTo(second) <= 0 ? first + "|" + second : second + "|" + first;
    }

    // ========== Result Types ==========

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DetectionMetrics {
        private long totalDetected;
        private double emergenceRate;
        private long metaPatternCount;

        static DetectionMetrics initial() {
            return new DetectionMetrics(0, 0.0, 0);
        }
    }

    public record EmergenceEvent(Instant observedAt, EmergenceLevel level, double meanEmergence, int patternCount) {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatternState {
        private int patternCount;
        private Map<PatternType, Long> patternsByType;
        private int metaPatternCount;
        private int graphNodes;
        private int graphEdges;
        private double graphComplexity;
        private int evolvingPatterns;
        private int emergenceEvents;
        private DetectionMetrics metrics;
        private int bufferSize;
    }
}
