package com.z254.horizon.adaptation;

import com.z254.horizon.adaptation.AdaptationTelemetry.Verdict;
import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.ResourceAuthorityClient;
import com.z254.horizon.client.ResourceAuthorityClient.AllocationResult;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.exception.SignalValidationException;
import com.z254.horizon.domain.model.Adaptation;
import com.z254.horizon.domain.model.AdaptationMetrics;
import com.z254.horizon.domain.model.AdaptationProposal;
import com.z254.horizon.domain.model.AdaptationResults;
import com.z254.horizon.domain.model.AdaptationStatus;
import com.z254.horizon.domain.model.Challenge;
import com.z254.horizon.domain.model.ChallengeType;
import com.z254.horizon.domain.model.ModelType;
import com.z254.horizon.domain.model.Scope;
import com.z254.horizon.domain.model.Urgency;
import com.z254.horizon.domain.model.ViabilityMetrics;
import com.z254.horizon.kafka.IntelligenceEventProducer;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.observability.HorizonStructuredLogger.AdaptationEventType;
import com.z254.horizon.runtime.ComponentMailbox;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ScheduledFuture;

/**
 * Adaptation component.
 * <p>
 * Generates proposals from challenges, submits them to the policy authority
 * and tracks approved adaptations to completion. Each active adaptation has
 * its own monitoring timer on the component mailbox, so concurrent
 * adaptations progress independently.
 */
@Slf4j
@Service
public class AdaptationEngine {

    private final Map<ModelType, AdaptationModel> models = new EnumMap<>(ModelType.class);
    private final TimelineResolver timelineResolver;
    private final AdaptationTelemetry telemetry;
    private final PolicyAuthorityClient policyAuthority;
    private final ResourceAuthorityClient resourceAuthority;
    private final IntelligenceEventProducer eventProducer;
    private final HorizonMetrics metrics;
    private final HorizonStructuredLogger structuredLogger;
    private final HorizonProperties.Adaptation config;
    private final Clock clock;
    private final ComponentMailbox mailbox;

    // Mailbox-confined state
    private final Map<String, Adaptation> active = new LinkedHashMap<>();
    private final Map<String, ScheduledFuture<?>> monitors = new HashMap<>();
    private final Deque<Adaptation> history = new ArrayDeque<>();
    private AdaptationMetrics adaptationMetrics = AdaptationMetrics.initial();
    private long proposalCounter;

    public AdaptationEngine(List<AdaptationModel> adaptationModels,
                            TimelineResolver timelineResolver,
                            AdaptationTelemetry telemetry,
                            PolicyAuthorityClient policyAuthority,
                            ResourceAuthorityClient resourceAuthority,
                            IntelligenceEventProducer eventProducer,
                            HorizonMetrics metrics,
                            HorizonStructuredLogger structuredLogger,
                            HorizonProperties horizonProperties,
                            Clock clock) {
        adaptationModels.forEach(model -> models.put(model.type(), model));
        this.timelineResolver = timelineResolver;
        this.telemetry = telemetry;
        this.policyAuthority = policyAuthority;
        this.resourceAuthority = resourceAuthority;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = horizonProperties.getAdaptation();
        this.clock = clock;
        this.mailbox = new ComponentMailbox("adaptation-engine");
    }

    @PreDestroy
    public void stop() {
        mailbox.shutdown();
    }

    // ========== Operations ==========

    /**
     * Build a proposal with the model matching the challenge urgency.
     */
    public Mono<AdaptationProposal> generateProposal(Challenge challenge) {
        return mailbox.request("generate-proposal", () -> propose(challenge));
    }

    /**
     * Start implementing a proposal: record it as in progress, request
     * resources and start its monitoring timer.
     */
    public void implementAdaptation(AdaptationProposal proposal) {
        mailbox.tell("implement-adaptation", () -> start(proposal));
    }

    public Mono<List<Adaptation>> getActiveAdaptations() {
        return mailbox.request("active-adaptations", () -> active.values().stream()
                .map(a -> a.toBuilder().build())
                .toList());
    }

    public Mono<AdaptationMetrics> getAdaptationMetrics() {
        return mailbox.request("adaptation-metrics", () -> adaptationMetrics.toBuilder()
                .activeAdaptations(active.size())
                .adaptationCapacity(AdaptationMetrics.capacityFor(active.size()))
                .build());
    }

    public Mono<List<Adaptation>> getAdaptationHistory() {
        return mailbox.request("adaptation-history", () -> List.copyOf(history));
    }

    /**
     * Derive challenges from viability readings and submit a proposal for each.
     * Approvals arrive asynchronously; an approved proposal is implemented.
     *
     * @return the proposals submitted
     */
    public Mono<List<AdaptationProposal>> requestProposalsForViability(ViabilityMetrics viability) {
        return mailbox.request("proposals-for-viability", () -> {
            List<AdaptationProposal> proposals = new ArrayList<>();
            for (Challenge challenge : challengesFor(viability)) {
                AdaptationProposal proposal = propose(challenge);
                submit(proposal);
                proposals.add(proposal);
            }
            return proposals;
        });
    }

    /**
     * Propose and submit an adaptation for a single challenge.
     */
    public void handleAdaptationNeeded(Challenge challenge) {
        mailbox.tell("adaptation-needed", () -> submit(propose(challenge)));
    }

    /**
     * Run the progress check of one adaptation now.
     */
    Mono<Boolean> checkProgressNow(String adaptationId) {
        return mailbox.request("check-progress", () -> {
            checkProgress(adaptationId);
            return !active.containsKey(adaptationId);
        });
    }

    // ========== Proposals ==========

    private AdaptationProposal propose(Challenge challenge) {
        if (challenge == null) {
            throw SignalValidationException.missing("challenge");
        }
        if (challenge.getType() == null) {
            throw SignalValidationException.missing("type");
        }
        if (challenge.getUrgency() == null) {
            throw SignalValidationException.missing("urgency");
        }
        if (challenge.getScope() == null) {
            challenge = challenge.toBuilder().scope(Scope.TACTICAL).build();
        }

        AdaptationModel model = models.get(modelFor(challenge.getUrgency()));
        Instant now = clock.instant();
        AdaptationProposal proposal = AdaptationProposal.builder()
                .id("ADAPT-" + now.toEpochMilli() + "-" + (++proposalCounter))
                .challenge(challenge)
                .modelType(model.type())
                .actions(model.generateActions(challenge))
                .impact(model.estimateImpact(challenge))
                .resourcesRequired(model.estimateResources(challenge))
                .timeline(model.estimateTimeline(challenge))
                .risks(model.identifyRisks(challenge))
                .createdAt(now)
                .build();

        metrics.recordProposalGenerated();
        structuredLogger.logAdaptationEvent(proposal.getId(), AdaptationEventType.PROPOSED,
                "Adaptation proposal generated", Map.of(
                        "challenge", challenge.getType(),
                        "urgency", challenge.getUrgency(),
                        "model", proposal.getModelType(),
                        "impact", proposal.getImpact()));
        return proposal;
    }

    static ModelType modelFor(Urgency urgency) {
        return switch (urgency) {
            case HIGH, CRITICAL -> ModelType.DEFENSIVE;
            case MEDIUM -> ModelType.INCREMENTAL;
            case LOW -> ModelType.TRANSFORMATIONAL;
        };
    }

    static List<Challenge> challengesFor(ViabilityMetrics viability) {
        List<Challenge> challenges = new ArrayList<>();
        if (viability.getHealth() < 0.7) {
            challenges.add(Challenge.of(ChallengeType.HEALTH, Urgency.HIGH, Scope.SYSTEM_WIDE));
        }
        if (viability.getEfficiency() < 0.6) {
            challenges.add(Challenge.of(ChallengeType.EFFICIENCY, Urgency.MEDIUM, Scope.OPERATIONAL));
        }
        if (viability.getInnovationLag() > 0.8) {
            challenges.add(Challenge.of(ChallengeType.INNOVATION, Urgency.LOW, Scope.STRATEGIC));
        }
        return challenges;
    }

    private void submit(AdaptationProposal proposal) {
        structuredLogger.logAdaptationEvent(proposal.getId(), AdaptationEventType.SUBMITTED,
                "Adaptation proposal submitted for approval", Map.of("model", proposal.getModelType()));
        policyAuthority.approveAdaptation(proposal).subscribe(
                decision -> {
                    if (decision.approved()) {
                        structuredLogger.logAdaptationEvent(proposal.getId(), AdaptationEventType.APPROVED,
                                "Adaptation approved", Map.of());
                        implementAdaptation(proposal);
                    } else {
                        structuredLogger.logAdaptationEvent(proposal.getId(), AdaptationEventType.REJECTED,
                                "Adaptation rejected", Map.of("reason", String.valueOf(decision.reason())));
                    }
                },
                e -> log.warn("Approval request for {} failed: {}", proposal.getId(), e.getMessage()));
    }

    // ========== Implementation ==========

    private void start(AdaptationProposal proposal) {
        if (active.containsKey(proposal.getId())) {
            log.debug("Adaptation {} already in progress", proposal.getId());
            return;
        }
        Adaptation adaptation = Adaptation.start(proposal, clock.instant());
        active.put(adaptation.getId(), adaptation);
        metrics.recordAdaptationStarted();
        structuredLogger.logAdaptationEvent(adaptation.getId(), AdaptationEventType.STARTED,
                "Adaptation started", Map.of(
                        "model", proposal.getModelType(),
                        "timeline", String.valueOf(proposal.getTimeline())));

        String id = adaptation.getId();
        resourceAuthority.allocateForAdaptation(proposal).subscribe(
                result -> mailbox.tell("allocation-reply", () -> applyAllocation(id, result)),
                e -> mailbox.tell("allocation-reply", () -> applyAllocation(id, AllocationResult.denied(e.getMessage()))));

        scheduleMonitor(id);
    }

    private void applyAllocation(String adaptationId, AllocationResult result) {
        Adaptation adaptation = active.get(adaptationId);
        if (adaptation == null || result.granted()) {
            return;
        }
        adaptation.setResourceConstrained(true);
        adaptation.setConstraintReason(result.reason());
        metrics.recordResourceConstrained();
        structuredLogger.logAdaptationEvent(adaptationId, AdaptationEventType.RESOURCE_CONSTRAINED,
                "Adaptation continues without resource allocation",
                Map.of("reason", String.valueOf(result.reason())));
    }

    private void scheduleMonitor(String adaptationId) {
        ScheduledFuture<?> previous = monitors.remove(adaptationId);
        if (previous != null) {
            previous.cancel(false);
        }
        ScheduledFuture<?> next = mailbox.after("monitor-" + adaptationId, config.getMonitorInterval(),
                () -> checkProgress(adaptationId));
        if (next != null) {
            monitors.put(adaptationId, next);
        }
    }

    private void checkProgress(String adaptationId) {
        Adaptation adaptation = active.get(adaptationId);
        if (adaptation == null) {
            return;
        }
        double progress;
        try {
            progress = progressOf(adaptation);
        } catch (RuntimeException e) {
            metrics.recordProgressFault();
            structuredLogger.logAdaptationEvent(adaptationId, AdaptationEventType.PROGRESS_FAULT,
                    "Progress check failed, treating as no progress", Map.of("error", String.valueOf(e.getMessage())));
            progress = 0.0;
        }
        adaptation.setLastProgress(progress);
        structuredLogger.logAdaptationEvent(adaptationId, AdaptationEventType.PROGRESS_CHECKED,
                "Adaptation progress checked", Map.of("progress", progress));

        if (progress >= config.getCompletionThreshold()) {
            Verdict verdict = telemetry.assessCompletion(adaptation, progress);
            if (verdict != Verdict.PENDING) {
                complete(adaptation, progress, verdict == Verdict.CONFIRMED);
                return;
            }
        }
        scheduleMonitor(adaptationId);
    }

    private double progressOf(Adaptation adaptation) {
        Duration expected = timelineResolver.resolve(adaptation.getProposal().getTimeline());
        Duration elapsed = Duration.between(adaptation.getStartedAt(), clock.instant());
        if (expected.toMillis() <= 0) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, (double) elapsed.toMillis() / expected.toMillis()));
    }

    private void complete(Adaptation adaptation, double progress, boolean success) {
        Instant now = clock.instant();
        AdaptationResults results = new AdaptationResults(success, progress, 0.1 * progress, 0.15 * progress);
        Adaptation completed = adaptation.toBuilder()
                .status(AdaptationStatus.COMPLETED)
                .completedAt(now)
                .results(results)
                .build();

        active.remove(adaptation.getId());
        ScheduledFuture<?> timer = monitors.remove(adaptation.getId());
        if (timer != null) {
            timer.cancel(false);
        }
        history.addLast(completed);
        while (history.size() > config.getHistorySize()) {
            history.removeFirst();
        }

        Duration took = Duration.between(adaptation.getStartedAt(), now);
        updateMetrics(results, adaptation.getProposal().getModelType(), took);
        metrics.recordAdaptationCompleted(took);
        structuredLogger.logAdaptationEvent(completed.getId(), AdaptationEventType.COMPLETED,
                "Adaptation completed", Map.of(
                        "success", success,
                        "progress", progress,
                        "durationSeconds", took.toSeconds()));
        eventProducer.emitAdaptationCompleted(completed);
    }

    private void updateMetrics(AdaptationResults results, ModelType modelType, Duration took) {
        long completedCount = adaptationMetrics.getCompletedAdaptations() + 1;
        double seconds = took.toMillis() / 1000.0;
        double average = adaptationMetrics.getAverageCompletionTime()
                + (seconds - adaptationMetrics.getAverageCompletionTime()) / completedCount;
        AdaptationMetrics.AdaptationMetricsBuilder next = adaptationMetrics.toBuilder()
                .averageCompletionTime(average)
                .completedAdaptations(completedCount);

        if (!results.isSuccess()) {
            adaptationMetrics = next.successRate(adaptationMetrics.getSuccessRate() * 0.95).build();
            return;
        }
        next.successRate(adaptationMetrics.getSuccessRate() * 0.95 + 0.05)
                .resourceEfficiency(Math.min(1.0,
                        adaptationMetrics.getResourceEfficiency() + 0.1 * results.getEfficiencyGain()));
        // only transformational change moves the innovation index
        if (modelType == ModelType.TRANSFORMATIONAL) {
            next.innovationIndex(Math.min(1.0,
                    adaptationMetrics.getInnovationIndex() + 0.1 * results.getEffectivenessGain()));
        }
        adaptationMetrics = next.build();
    }
}
