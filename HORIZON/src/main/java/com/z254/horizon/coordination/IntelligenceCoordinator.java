package com.z254.horizon.coordination;

import com.z254.horizon.adaptation.AdaptationEngine;
import com.z254.horizon.domain.model.Adaptation;
import com.z254.horizon.domain.model.AdaptationMetrics;
import com.z254.horizon.domain.model.AdaptationProposal;
import com.z254.horizon.domain.model.CascadePrediction;
import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.DataStream;
import com.z254.horizon.domain.model.DetectionResult;
import com.z254.horizon.domain.model.ExplosionEvent;
import com.z254.horizon.domain.model.ExplosionRiskAssessment;
import com.z254.horizon.domain.model.Pattern;
import com.z254.horizon.domain.model.RiskReport;
import com.z254.horizon.domain.model.ScanScope;
import com.z254.horizon.domain.model.SignalSnapshot;
import com.z254.horizon.domain.model.VarietyData;
import com.z254.horizon.domain.model.VarietyState;
import com.z254.horizon.domain.model.ViabilityMetrics;
import com.z254.horizon.pattern.EmergenceAnalyzer.EmergenceAnalysis;
import com.z254.horizon.pattern.MetaPatternAnalyzer.MetaPatternScan;
import com.z254.horizon.pattern.PatternDetector;
import com.z254.horizon.pattern.PatternDetector.PatternState;
import com.z254.horizon.pattern.PatternEvolutionModel.EvolutionRecord;
import com.z254.horizon.pattern.PatternEvolutionModel.TrajectoryPrediction;
import com.z254.horizon.scanner.EnvironmentalScanner;
import com.z254.horizon.variety.VarietyMonitor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point to the intelligence components. Routes each call to the
 * owning component and holds no state of its own.
 * <p>
 * {@link #runIntelligenceCycle(ScanScope)} chains the components: the scan
 * feeds pattern detection, and the scan's variety indicators together with
 * the newly detected patterns feed the variety monitor, which hands elevated
 * risk to the adaptation engine.
 */
@Service
public class IntelligenceCoordinator {

    private final EnvironmentalScanner scanner;
    private final PatternDetector patternDetector;
    private final VarietyMonitor varietyMonitor;
    private final AdaptationEngine adaptationEngine;

    public IntelligenceCoordinator(EnvironmentalScanner scanner,
                                   PatternDetector patternDetector,
                                   VarietyMonitor varietyMonitor,
                                   AdaptationEngine adaptationEngine) {
        this.scanner = scanner;
        this.patternDetector = patternDetector;
        this.varietyMonitor = varietyMonitor;
        this.adaptationEngine = adaptationEngine;
    }

    // Scanning

    public Mono<SignalSnapshot> scan(ScanScope scope) {
        return scanner.scan(scope);
    }

    /**
     * Scan, detect patterns in the snapshot and assess the variety it carries.
     */
    public Mono<IntelligenceCycle> runIntelligenceCycle(ScanScope scope) {
        return scanner.scan(scope).flatMap(snapshot -> {
            Mono<Optional<DetectionResult>> detection = snapshot.isSourceAvailable() && !snapshot.isEmpty()
                    ? patternDetector.detectPatterns(snapshot).map(Optional::of)
                    : Mono.just(Optional.<DetectionResult>empty());
            return detection.flatMap(result -> varietyReading(snapshot, result.orElse(null))
                    .map(reading -> varietyMonitor.monitorVariety(reading).map(Optional::of))
                    .orElseGet(() -> Mono.just(Optional.<RiskReport>empty()))
                    .map(report -> new IntelligenceCycle(snapshot, result.orElse(null), report.orElse(null))));
        });
    }

    /**
     * Variety indicators of the scan plus the emergent patterns and
     * meta-patterns just detected, or empty when there is nothing to assess.
     */
    static Optional<VarietyData> varietyReading(SignalSnapshot snapshot, DetectionResult detection) {
        VarietyData indicators = snapshot.getLlmVariety();
        boolean detected = detection != null
                && !(detection.getPatterns().isEmpty() && detection.getMetaPatterns().isEmpty());
        if (indicators == null && !detected) {
            return Optional.empty();
        }
        VarietyData base = indicators != null ? indicators : VarietyData.builder().build();
        Map<String, Object> novelPatterns = new HashMap<>(base.getNovelPatterns());
        List<String> emergentProperties = new ArrayList<>(base.getEmergentProperties());
        if (detected) {
            detection.getPatterns().forEach(p -> novelPatterns.put(p.getId(), p.getPatternType()));
            detection.getMetaPatterns().forEach(m -> emergentProperties.add(m.getId()));
        }
        return Optional.of(VarietyData.builder()
                .novelPatterns(novelPatterns)
                .emergentProperties(emergentProperties)
                .recursivePotential(base.getRecursivePotential())
                .metaSystemSeeds(base.getMetaSystemSeeds())
                .quantumSuperposition(base.isQuantumSuperposition())
                .build());
    }

    // Patterns

    public Mono<DetectionResult> detectPatterns(DataStream stream) {
        return patternDetector.detectPatterns(stream);
    }

    public Mono<DetectionResult> detectPatterns(SignalSnapshot snapshot) {
        return patternDetector.detectPatterns(snapshot);
    }

    public Mono<EmergenceAnalysis> analyzeEmergence(Collection<Pattern> patterns) {
        return patternDetector.analyzeEmergence(patterns);
    }

    public Mono<Optional<EvolutionRecord>> trackEvolution(String patternId) {
        return patternDetector.trackEvolution(patternId);
    }

    public Mono<TrajectoryPrediction> predictPatternTrajectory(Pattern pattern, Duration horizon) {
        return patternDetector.predictPatternTrajectory(pattern, horizon);
    }

    public Mono<MetaPatternScan> identifyMetaPatterns() {
        return patternDetector.identifyMetaPatterns();
    }

    public Mono<PatternState> getPatternState() {
        return patternDetector.getPatternState();
    }

    // Variety

    public Mono<RiskReport> monitorVariety(VarietyData data) {
        return varietyMonitor.monitorVariety(data);
    }

    public Mono<ExplosionRiskAssessment> checkExplosionRisk() {
        return varietyMonitor.checkExplosionRisk();
    }

    public Mono<CascadePrediction> predictCascade(double currentVariety) {
        return varietyMonitor.predictCascade(currentVariety);
    }

    public Mono<VarietyState> getVarietyState() {
        return varietyMonitor.getVarietyState();
    }

    public Mono<List<ExplosionEvent>> getExplosionEvents() {
        return varietyMonitor.getExplosionEvents();
    }

    public Mono<List<CascadePrediction>> getCascadePredictions() {
        return varietyMonitor.getCascadePredictions();
    }

    public void triggerEmergencyResponse(RiskReport report) {
        varietyMonitor.triggerEmergencyResponse(report);
    }

    // Adaptation

    public Mono<AdaptationProposal> generateProposal(Challenge challenge) {
        return adaptationEngine.generateProposal(challenge);
    }

    public void implementAdaptation(AdaptationProposal proposal) {
        adaptationEngine.implementAdaptation(proposal);
    }

    public void handleAdaptationNeeded(Challenge challenge) {
        adaptationEngine.handleAdaptationNeeded(challenge);
    }

    public Mono<List<Adaptation>> getActiveAdaptations() {
        return adaptationEngine.getActiveAdaptations();
    }

    public Mono<AdaptationMetrics> getAdaptationMetrics() {
        return adaptationEngine.getAdaptationMetrics();
    }

    public Mono<List<Adaptation>> getAdaptationHistory() {
        return adaptationEngine.getAdaptationHistory();
    }

    public Mono<List<AdaptationProposal>> requestProposalsForViability(ViabilityMetrics viability) {
        return adaptationEngine.requestProposalsForViability(viability);
    }

    /**
     * Outcome of one intelligence cycle. {@code detection} is null when the
     * snapshot was empty or unavailable; {@code riskReport} is null when there
     * was no variety to assess.
     */
    public record IntelligenceCycle(SignalSnapshot snapshot, DetectionResult detection, RiskReport riskReport) {
    }
}
