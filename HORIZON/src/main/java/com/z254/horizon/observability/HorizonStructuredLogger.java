package com.z254.horizon.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for HORIZON service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for pattern, adaptation and protocol ids</li>
 *     <li>Domain-specific logging methods for scans, patterns, variety and adaptations</li>
 * </ul>
 */
@Slf4j
@Component
public class HorizonStructuredLogger {

    // MDC keys
    public static final String MDC_COMPONENT = "component";
    public static final String MDC_PATTERN_ID = "patternId";
    public static final String MDC_ADAPTATION_ID = "adaptationId";
    public static final String MDC_PROTOCOL = "protocol";

    /**
     * Log a scan event.
     */
    public void logScanEvent(ScanEventType eventType, String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_COMPONENT, "scanner"))) {
            Map<String, Object> logData = eventData(eventType, details);
            switch (eventType) {
                case SOURCE_UNAVAILABLE, VALIDATION_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a pattern detection event.
     */
    public void logPatternEvent(String patternId, PatternEventType eventType, String message,
                                Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_COMPONENT, "pattern-detector",
                MDC_PATTERN_ID, patternId != null ? patternId : ""))) {

            Map<String, Object> logData = eventData(eventType, details);
            if (patternId != null) {
                logData.put("patternId", patternId);
            }

            switch (eventType) {
                case DETECTION_COMPLETED, META_PATTERN_FORMED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                case EMERGENCE_SIGNIFICANT, EVOLUTION_PROPOSED, EMERGENCE_ESCALATED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case VALIDATION_FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a variety monitoring event.
     */
    public void logVarietyEvent(VarietyEventType eventType, String protocol, String message,
                                Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_COMPONENT, "variety-monitor",
                MDC_PROTOCOL, protocol != null ? protocol : ""))) {

            Map<String, Object> logData = eventData(eventType, details);
            if (protocol != null) {
                logData.put("protocol", protocol);
            }

            switch (eventType) {
                case ASSESSED, CAPACITY_ADAPTED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                case UNCONTROLLED_EXPLOSION, CASCADE_ESCALATED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                case PROTOCOL_EXECUTED, ACTION_FAILED, THRESHOLD_EXCEEDED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an adaptation lifecycle event.
     */
    public void logAdaptationEvent(String adaptationId, AdaptationEventType eventType, String message,
                                   Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_COMPONENT, "adaptation-engine",
                MDC_ADAPTATION_ID, adaptationId != null ? adaptationId : ""))) {

            Map<String, Object> logData = eventData(eventType, details);
            if (adaptationId != null) {
                logData.put("adaptationId", adaptationId);
            }

            switch (eventType) {
                case PROGRESS_FAULT ->
                        log.error("{} | data={}", message, formatLogData(logData));
                case RESOURCE_CONSTRAINED, REJECTED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case PROGRESS_CHECKED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private Map<String, Object> eventData(Enum<?> eventType, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", eventType.name());
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Double d && !Double.isFinite(d)) {
                sb.append("\"").append(d).append("\"");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum ScanEventType {
        COMPLETED, SOURCE_UNAVAILABLE, VALIDATION_FAILED, FORWARDED
    }

    public enum PatternEventType {
        DETECTION_COMPLETED, EMERGENT_DETECTED, META_PATTERN_FORMED, EMERGENCE_SIGNIFICANT,
        EMERGENCE_ESCALATED, EVOLUTION_PROPOSED, VALIDATION_FAILED
    }

    public enum VarietyEventType {
        ASSESSED, THRESHOLD_EXCEEDED, ABSORBED, UNCONTROLLED_EXPLOSION, PROTOCOL_EXECUTED,
        ACTION_FAILED, CASCADE_PREDICTED, CASCADE_ESCALATED, CAPACITY_ADAPTED, ADAPTATION_REQUESTED,
        MEASURES_RELEASED
    }

    public enum AdaptationEventType {
        PROPOSED, SUBMITTED, APPROVED, REJECTED, STARTED, RESOURCE_CONSTRAINED,
        PROGRESS_CHECKED, PROGRESS_FAULT, COMPLETED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
