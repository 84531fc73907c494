package com.z254.horizon.config;

import com.z254.horizon.domain.model.ProtocolName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for HORIZON service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Scanner cadence and upstream timeouts</li>
 *     <li>Pattern detection windows and thresholds</li>
 *     <li>Variety thresholds, capacity bounds and emergency protocols</li>
 *     <li>Adaptation monitoring</li>
 *     <li>Collaborator client settings (policy, resource, signal source)</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "horizon")
public class HorizonProperties {

    private final Scanner scanner = new Scanner();
    private final Pattern pattern = new Pattern();
    private final Variety variety = new Variety();
    private final Adaptation adaptation = new Adaptation();
    private final Clients clients = new Clients();
    private final Kafka kafka = new Kafka();

    /**
     * Environmental scanner configuration.
     */
    @Data
    public static class Scanner {
        /** Enable the periodic scan timer */
        private boolean scheduledScanEnabled = true;

        /** Interval between periodic scans */
        private Duration scanInterval = Duration.ofSeconds(60);

        /** How long a scan waits for the signal source */
        private Duration sourceTimeout = Duration.ofSeconds(5);

        @Positive
        private int historySize = 100;
    }

    /**
     * Pattern detection configuration.
     */
    @Data
    public static class Pattern {
        /** Interval between buffered-input analysis ticks */
        private Duration analysisInterval = Duration.ofSeconds(1);

        @Positive
        private int segmentSize = 100;

        @Positive
        private int segmentStep = 90;

        @Positive
        private int historySize = 1000;

        @Positive
        private int evolutionHistorySize = 100;

        @Positive
        private int emergenceEventLimit = 100;

        /** Similarity above which a candidate is considered known */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double emergenceSimilarityThreshold = 0.8;

        /** Correlation above which two patterns form a meta-pattern */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double metaCorrelationThreshold = 0.85;

        /** Correlation above which two patterns are linked in the graph */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double edgeCorrelationThreshold = 0.5;

        /** Emergent patterns per cycle above which the policy authority is notified */
        private int emergentNotificationThreshold = 10;

        /** Meta-patterns per cycle above which the policy authority is notified */
        private int metaNotificationThreshold = 3;
    }

    /**
     * Variety explosion detection configuration.
     */
    @Data
    public static class Variety {
        /** Interval between self-assessment ticks */
        private Duration assessmentInterval = Duration.ofSeconds(5);

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double explosionThreshold = 0.85;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double cascadeThreshold = 0.75;

        @Positive
        private double criticalRatio = 3.0;

        @Positive
        private double initialCapacity = 1.0;

        @Positive
        private double minCapacity = 0.5;

        @Positive
        private double maxCapacity = 10.0;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double initialAbsorptionRate = 0.7;

        @Positive
        private int historySize = 1000;

        @Positive
        private int explosionEventLimit = 100;

        @Positive
        private int cascadePredictionLimit = 50;

        /** Emergency protocols keyed by name */
        private Map<ProtocolName, Protocol> protocols = defaultProtocols();

        private static Map<ProtocolName, Protocol> defaultProtocols() {
            Map<ProtocolName, Protocol> defaults = new EnumMap<>(ProtocolName.class);
            defaults.put(ProtocolName.META_SPAWN,
                    new Protocol(0.9, new ArrayList<>(List.of("spawn_meta_system", "redistribute_variety"))));
            defaults.put(ProtocolName.CASCADE_PREVENTION,
                    new Protocol(0.75, new ArrayList<>(List.of("isolate_subsystems", "activate_dampeners"))));
            defaults.put(ProtocolName.EMERGENCY_FILTER,
                    new Protocol(0.7, new ArrayList<>(List.of("activate_filters", "reduce_inputs"))));
            defaults.put(ProtocolName.CONTROLLED_DEGRADATION,
                    new Protocol(0.6, new ArrayList<>(List.of("reduce_functionality", "preserve_core"))));
            return defaults;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Protocol {
            @DecimalMin("0.0") @DecimalMax("1.0")
            private double triggerThreshold;
            private List<String> actions = new ArrayList<>();
        }
    }

    /**
     * Adaptation engine configuration.
     */
    @Data
    public static class Adaptation {
        /** Interval between monitoring ticks of one active adaptation */
        private Duration monitorInterval = Duration.ofSeconds(10);

        /** Progress at which an adaptation may complete */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double completionThreshold = 0.9;

        /** Expected duration used when a timeline cannot be resolved */
        private Duration defaultDuration = Duration.ofDays(30);

        @Positive
        private int historySize = 100;
    }

    /**
     * Collaborator client configuration.
     */
    @Data
    public static class Clients {
        private final Endpoint policyAuthority = new Endpoint();
        private final Endpoint resourceAuthority = new Endpoint();
        private final Endpoint signalSource = new Endpoint();

        @Data
        public static class Endpoint {
            /** Empty base URL runs the client in stub mode */
            private String baseUrl = "";
            private Duration timeout = Duration.ofSeconds(10);
        }
    }

    /**
     * Kafka topics for intelligence events.
     */
    @Data
    public static class Kafka {
        private boolean enabled = true;
        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            @NotBlank
            private String emergentPatterns = "horizon.patterns.emergent";
            @NotBlank
            private String explosionEvents = "horizon.variety.explosions";
            @NotBlank
            private String cascadePredictions = "horizon.variety.cascades";
            @NotBlank
            private String adaptations = "horizon.adaptations.completed";
        }
    }
}
