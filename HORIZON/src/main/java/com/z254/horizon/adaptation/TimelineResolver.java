package com.z254.horizon.adaptation;

import com.z254.horizon.config.HorizonProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Resolves proposal timelines to durations. Named timelines map to fixed day
 * counts, positive numbers are read as seconds (at least one millisecond) and
 * anything else falls back to the configured default.
 */
@Slf4j
@Component
public class TimelineResolver {

    private static final Map<String, Duration> NAMED = Map.of(
            "1_week", Duration.ofDays(7),
            "2_weeks", Duration.ofDays(14),
            "1_month", Duration.ofDays(30),
            "2_months", Duration.ofDays(60),
            "3_months", Duration.ofDays(90),
            "6_months", Duration.ofDays(180));

    private final Duration fallback;

    public TimelineResolver(HorizonProperties horizonProperties) {
        this.fallback = horizonProperties.getAdaptation().getDefaultDuration();
    }

    public Duration resolve(String timeline) {
        if (timeline == null || timeline.isBlank()) {
            return fallback;
        }
        Duration named = NAMED.get(timeline);
        if (named != null) {
            return named;
        }
        try {
            double seconds = Double.parseDouble(timeline);
            if (seconds > 0 && Double.isFinite(seconds)) {
                // sub-millisecond timelines round up so progress never divides by zero
                return Duration.ofMillis(Math.max(1L, (long) Math.ceil(seconds * 1000)));
            }
        } catch (NumberFormatException e) {
            log.debug("Unrecognized timeline '{}', using {}", timeline, fallback);
        }
        return fallback;
    }
}
