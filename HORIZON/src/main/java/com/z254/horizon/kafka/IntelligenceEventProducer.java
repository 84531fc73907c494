package com.z254.horizon.kafka;

import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.Adaptation;
import com.z254.horizon.domain.model.CascadePrediction;
import com.z254.horizon.domain.model.ExplosionEvent;
import com.z254.horizon.domain.model.MetaPattern;
import com.z254.horizon.domain.model.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Kafka producer for intelligence observability events.
 * Publishing never fails the caller; delivery errors are logged.
 */
@Slf4j
@Component
public class IntelligenceEventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final HorizonProperties horizonProperties;

    public IntelligenceEventProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                     HorizonProperties horizonProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.horizonProperties = horizonProperties;
    }

    public void emitEmergentPatterns(List<Pattern> patterns, List<MetaPattern> metaPatterns, double emergenceScore) {
        if (patterns.isEmpty() && metaPatterns.isEmpty()) {
            return;
        }
        String key = patterns.isEmpty() ? metaPatterns.get(0).getId() : patterns.get(0).getId();
        emit(horizonProperties.getKafka().getTopics().getEmergentPatterns(), key,
                new IntelligenceEvent(EventType.EMERGENT_PATTERNS,
                        new EmergentPatternBatch(patterns, metaPatterns, emergenceScore)));
    }

    public void emitExplosionEvent(ExplosionEvent event) {
        emit(horizonProperties.getKafka().getTopics().getExplosionEvents(), event.getEventType().name(),
                new IntelligenceEvent(EventType.VARIETY_EXPLOSION, event));
    }

    public void emitCascadePrediction(CascadePrediction prediction) {
        emit(horizonProperties.getKafka().getTopics().getCascadePredictions(), "cascade",
                new IntelligenceEvent(EventType.CASCADE_PREDICTED, prediction));
    }

    public void emitAdaptationCompleted(Adaptation adaptation) {
        emit(horizonProperties.getKafka().getTopics().getAdaptations(), adaptation.getId(),
                new IntelligenceEvent(EventType.ADAPTATION_COMPLETED, adaptation));
    }

    // ========== Private Helper Methods ==========

    private void emit(String topic, String key, IntelligenceEvent event) {
        if (!horizonProperties.getKafka().isEnabled()) {
            log.debug("Kafka disabled, not emitting {} event {}", event.eventType(), event.eventId());
            return;
        }
        try {
            kafkaTemplate.send(topic, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to emit {} event: eventId={}, error={}",
                                    event.eventType(), event.eventId(), ex.getMessage());
                        } else {
                            log.debug("Emitted {} event: eventId={}, topic={}, partition={}",
                                    event.eventType(), event.eventId(), topic,
                                    result.getRecordMetadata().partition());
                        }
                    });
        } catch (Exception e) {
            log.error("Failed to send {} event to {}: {}", event.eventType(), topic, e.getMessage());
        }
    }

    public enum EventType {
        EMERGENT_PATTERNS, VARIETY_EXPLOSION, CASCADE_PREDICTED, ADAPTATION_COMPLETED
    }

    /**
     * Envelope for every published event.
     */
    public record IntelligenceEvent(String eventId, EventType eventType, Instant timestamp, Object payload) {

        IntelligenceEvent(EventType eventType, Object payload) {
            this(UUID.randomUUID().toString(), eventType, Instant.now(), payload);
        }
    }

    public record EmergentPatternBatch(List<Pattern> patterns, List<MetaPattern> metaPatterns,
                                       double emergenceScore) {
    }
}
