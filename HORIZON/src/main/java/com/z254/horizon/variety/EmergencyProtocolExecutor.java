package com.z254.horizon.variety;

import com.z254.horizon.client.PolicyAuthorityClient;
import com.z254.horizon.client.PolicyAuthorityClient.MetaSystemSpawnRequest;
import com.z254.horizon.client.ResourceAuthorityClient;
import com.z254.horizon.client.ResourceAuthorityClient.VarietyRedistributionRequest;
import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.ActionResult;
import com.z254.horizon.domain.model.ProtocolAction;
import com.z254.horizon.domain.model.ProtocolName;
import com.z254.horizon.domain.model.ProtocolResult;
import com.z254.horizon.domain.model.RiskReport;
import com.z254.horizon.domain.model.Urgency;
import com.z254.horizon.observability.HorizonMetrics;
import com.z254.horizon.observability.HorizonStructuredLogger;
import com.z254.horizon.observability.HorizonStructuredLogger.VarietyEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects and runs emergency protocols.
 * <p>
 * The protocol with the highest trigger threshold not above the risk is
 * selected. Its configured actions run in order; an unknown action yields a
 * failed {@link ActionResult} and the remaining actions still run.
 */
@Slf4j
@Component
public class EmergencyProtocolExecutor {

    private final PolicyAuthorityClient policyAuthority;
    private final ResourceAuthorityClient resourceAuthority;
    private final HorizonMetrics metrics;
    private final HorizonStructuredLogger structuredLogger;
    private final HorizonProperties.Variety config;
    private final Clock clock;

    public EmergencyProtocolExecutor(PolicyAuthorityClient policyAuthority,
                                     ResourceAuthorityClient resourceAuthority,
                                     HorizonMetrics metrics,
                                     HorizonStructuredLogger structuredLogger,
                                     HorizonProperties horizonProperties,
                                     Clock clock) {
        this.policyAuthority = policyAuthority;
        this.resourceAuthority = resourceAuthority;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = horizonProperties.getVariety();
        this.clock = clock;
    }

    public Optional<ProtocolName> select(double risk) {
        return config.getProtocols().entrySet().stream()
                .filter(e -> e.getValue().getTriggerThreshold() <= risk)
                .max(Map.Entry.comparingByValue(
                        (a, b) -> Double.compare(a.getTriggerThreshold(), b.getTriggerThreshold())))
                .map(Map.Entry::getKey);
    }

    /**
     * Lowest trigger threshold of the configured protocols; risk below it
     * calls for no protocol at all.
     */
    public double lowestTriggerThreshold() {
        return config.getProtocols().values().stream()
                .mapToDouble(HorizonProperties.Variety.Protocol::getTriggerThreshold)
                .min()
                .orElse(Double.POSITIVE_INFINITY);
    }

    /**
     * Select by the report's risk and run the protocol, if any.
     */
    public ProtocolResult respond(RiskReport report, ProtocolRun run) {
        return select(report.getExplosionRisk())
                .map(name -> execute(name, report, run))
                .orElseGet(ProtocolResult::none);
    }

    public ProtocolResult execute(ProtocolName name, RiskReport report, ProtocolRun run) {
        HorizonProperties.Variety.Protocol protocol = config.getProtocols().get(name);
        List<ActionResult> results = new ArrayList<>();
        for (String key : protocol.getActions()) {
            results.add(ProtocolAction.fromKey(key)
                    .map(action -> apply(action, report, run))
                    .orElseGet(() -> unknownAction(name, key)));
        }

        ProtocolResult result = ProtocolResult.of(name, results);
        int failed = (int) results.stream().filter(r -> !r.isSuccess()).count();
        metrics.recordProtocolExecuted(name, failed);
        structuredLogger.logVarietyEvent(VarietyEventType.PROTOCOL_EXECUTED, name.name(),
                "Emergency protocol executed", Map.of(
                        "risk", report.getExplosionRisk(),
                        "actions", results.size(),
                        "failedActions", failed,
                        "success", result.isSuccess()));
        return result;
    }

    /**
     * Ask the policy authority for a variety-absorbing meta-system, once per run.
     *
     * @return true if a request was sent
     */
    public boolean requestMetaSystem(RiskReport report, ProtocolRun run) {
        if (!run.markMetaSystemRequested()) {
            return false;
        }
        MetaSystemSpawnRequest request = new MetaSystemSpawnRequest(
                MetaSystemSpawnRequest.VARIETY_EXPLOSION,
                report.getExternalVariety(),
                report.getVarietyRatio(),
                report.getExplosionRisk(),
                Urgency.CRITICAL,
                MetaSystemSpawnRequest.VARIETY_ABSORBER,
                clock.instant());
        policyAuthority.spawnMetaSystemEmergency(request)
                .subscribe(v -> { }, e -> log.warn("Meta-system spawn request failed: {}", e.getMessage()));
        return true;
    }

    // ========== Private Helper Methods ==========

    private ActionResult apply(ProtocolAction action, RiskReport report, ProtocolRun run) {
        if (!run.markApplied(action)) {
            return ActionResult.ok(action.getKey(), "already applied in this run");
        }
        switch (action) {
            case SPAWN_META_SYSTEM -> {
                boolean sent = requestMetaSystem(report, run);
                return ActionResult.ok(action.getKey(), sent ? "meta-system requested" : "meta-system already requested");
            }
            case REDISTRIBUTE_VARIETY -> {
                // the report keeps changing on the mailbox thread, so the client gets a frozen copy
                resourceAuthority.redistributeVariety(VarietyRedistributionRequest.of(report))
                        .subscribe(v -> { }, e -> log.warn("Variety redistribution failed: {}", e.getMessage()));
                return ActionResult.ok(action.getKey(), "redistribution requested");
            }
            default -> {
                run.getActiveMeasures().add(action);
                return ActionResult.ok(action.getKey(), "measure active");
            }
        }
    }

    private ActionResult unknownAction(ProtocolName protocol, String key) {
        structuredLogger.logVarietyEvent(VarietyEventType.ACTION_FAILED, protocol.name(),
                "Unknown protocol action", Map.of("action", key));
        return ActionResult.failure(key, ActionResult.UNKNOWN_ACTION);
    }
}
