package com.z254.horizon.scanner;

import com.z254.horizon.client.SignalSourceClient;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.exception.SignalValidationException;
import com.z254.horizon.domain.model.ScanScope;
import com.z254.horizon.domain.model.SignalSnapshot;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.observability.HorizonStructuredLogger.ScanEventType;
import com.z254.horizon.pattern.PatternDetector;
import com.z254.horizon.runtime.ComponentMailbox;
import com.z254.horizon.variety.VarietyMonitor;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Environmental scanning component.
 * <p>
 * Collects signals for a scope from the signal source. An unreachable or slow
 * source yields an empty snapshot marked unavailable; it is recorded like any
 * other scan and not retried. A malformed snapshot is rejected.
 * <p>
 * Periodic scans feed the pattern detector and, when the snapshot carries
 * variety indicators, the variety monitor.
 */
@Slf4j
@Service
public class EnvironmentalScanner {

    private final SignalSourceClient signalSource;
    private final PatternDetector patternDetector;
    private final VarietyMonitor varietyMonitor;
    private final HorizonMetrics metrics;
    private final HorizonStructuredLogger structuredLogger;
    private final HorizonProperties.Scanner config;
    private final Clock clock;
    private final ComponentMailbox mailbox;

    // Mailbox-confined state
    private final Deque<SignalSnapshot> scanHistory = new ArrayDeque<>();

    public EnvironmentalScanner(SignalSourceClient signalSource,
                                PatternDetector patternDetector,
                                VarietyMonitor varietyMonitor,
                                HorizonMetrics metrics,
                                HorizonStructuredLogger structuredLogger,
                                HorizonProperties horizonProperties,
                                Clock clock) {
        this.signalSource = signalSource;
        this.patternDetector = patternDetector;
        this.varietyMonitor = varietyMonitor;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = horizonProperties.getScanner();
        this.clock = clock;
        this.mailbox = new ComponentMailbox("environmental-scanner");
    }

    @PostConstruct
    public void start() {
        if (config.isScheduledScanEnabled()) {
            mailbox.every("periodic-scan", config.getScanInterval(), this::periodicScan);
            log.info("Periodic environmental scan enabled: interval={}", config.getScanInterval());
        }
    }

    @PreDestroy
    public void stop() {
        mailbox.shutdown();
    }

    /**
     * Scan the environment for a scope.
     *
     * @return the snapshot; an empty, unavailable snapshot when the source fails
     */
    public Mono<SignalSnapshot> scan(ScanScope scope) {
        Timer.Sample sample = metrics.startScanTimer();
        return signalSource.fetchSnapshot(scope.getFamilies())
                .timeout(config.getSourceTimeout())
                .map(snapshot -> complete(snapshot, scope))
                .onErrorResume(e -> !(e instanceof SignalValidationException), e -> {
                    structuredLogger.logScanEvent(ScanEventType.SOURCE_UNAVAILABLE,
                            "Signal source unavailable, recording empty snapshot",
                            Map.of("scope", scope, "error", String.valueOf(e.getMessage())));
                    return Mono.just(SignalSnapshot.unavailable(scope, clock.instant()));
                })
                .switchIfEmpty(Mono.fromCallable(() -> SignalSnapshot.unavailable(scope, clock.instant())))
                .flatMap(snapshot -> mailbox.request("record-scan", () -> record(snapshot, sample)));
    }

    public Mono<List<SignalSnapshot>> getScanHistory() {
        return mailbox.request("scan-history", () -> List.copyOf(scanHistory));
    }

    // ========== Private Helper Methods ==========

    private SignalSnapshot complete(SignalSnapshot snapshot, ScanScope scope) {
        snapshot.setScope(scope);
        snapshot.setCoverage(scope.getCoverage());
        if (snapshot.getTimestamp() == null) {
            snapshot.setTimestamp(clock.instant());
        }
        try {
            snapshot.validate();
        } catch (SignalValidationException e) {
            structuredLogger.logScanEvent(ScanEventType.VALIDATION_FAILED, "Rejected malformed snapshot",
                    Map.of("scope", scope, "field", e.getField()));
            throw e;
        }
        return snapshot;
    }

    private SignalSnapshot record(SignalSnapshot snapshot, Timer.Sample sample) {
        scanHistory.addLast(snapshot);
        while (scanHistory.size() > config.getHistorySize()) {
            scanHistory.removeFirst();
        }
        metrics.recordScanCompleted(sample, snapshot.isSourceAvailable());
        structuredLogger.logScanEvent(ScanEventType.COMPLETED, "Environmental scan completed", Map.of(
                "scope", snapshot.getScope(),
                "sourceAvailable", snapshot.isSourceAvailable(),
                "marketSignals", snapshot.getMarketSignals().size(),
                "technologyTrends", snapshot.getTechnologyTrends().size(),
                "regulatoryUpdates", snapshot.getRegulatoryUpdates().size(),
                "competitiveMoves", snapshot.getCompetitiveMoves().size()));
        return snapshot;
    }

    private void periodicScan() {
        scan(ScanScope.FULL).subscribe(snapshot -> {
            if (snapshot.isSourceAvailable() && !snapshot.isEmpty()) {
                patternDetector.submitForAnalysis(snapshot);
                structuredLogger.logScanEvent(ScanEventType.FORWARDED,
                        "Snapshot forwarded for pattern analysis", Map.of("scope", snapshot.getScope()));
            }
            if (snapshot.getLlmVariety() != null) {
                varietyMonitor.monitorVariety(snapshot.getLlmVariety()).subscribe(
                        report -> log.debug("Scan variety assessed: risk={}", report.getExplosionRisk()),
                        e -> log.warn("Variety assessment of scan failed: {}", e.getMessage()));
            }
        }, e -> log.warn("Periodic scan failed: {}", e.getMessage()));
    }
}
