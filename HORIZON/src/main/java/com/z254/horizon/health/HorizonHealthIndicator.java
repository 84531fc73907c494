package com.z254.horizon.health;

import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.VarietyState;
import com.z254.horizon.variety.VarietyMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for HORIZON service.
 * <p>
 * Reports DOWN while the variety ratio is above the critical ratio, which is
 * when the monitor starts predicting cascades.
 */
@Slf4j
@Component
public class HorizonHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration STATE_TIMEOUT = Duration.ofSeconds(2);

    private final VarietyMonitor varietyMonitor;
    private final double criticalRatio;

    public HorizonHealthIndicator(VarietyMonitor varietyMonitor, HorizonProperties horizonProperties) {
        this.varietyMonitor = varietyMonitor;
        this.criticalRatio = horizonProperties.getVariety().getCriticalRatio();
    }

    @Override
    public Mono<Health> health() {
        return varietyMonitor.getVarietyState()
                .timeout(STATE_TIMEOUT)
                .map(this::toHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .build());
                });
    }

    private Health toHealth(VarietyState state) {
        Health.Builder builder = state.getVarietyRatio() > criticalRatio ? Health.down() : Health.up();
        return builder
                .withDetail("varietyRatio", state.getVarietyRatio())
                .withDetail("criticalRatio", criticalRatio)
                .withDetail("internalCapacity", state.getInternalVarietyCapacity())
                .withDetail("absorptionRate", state.getAbsorptionRate())
                .withDetail("explosionEvents", state.getExplosionEventCount())
                .withDetail("monitoringActive", state.isMonitoringActive())
                .build();
    }
}
