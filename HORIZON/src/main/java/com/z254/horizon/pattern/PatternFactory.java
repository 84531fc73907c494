package com.z254.horizon.pattern;

import com.z254.horizon.config.HorizonProperties;
import com.z254.horizon.domain.model.DataStream;
import com.z254.horizon.domain.model.Feature;
import com.z254.horizon.domain.model.FeatureType;
import com.z254.horizon.domain.model.Pattern;
import com.z254.horizon.domain.model.PatternType;
import com.z254.horizon.domain.model.StreamMarker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a data stream into candidate patterns: one pattern per feature-type
 * cluster, classified by signature rules.
 */
@Slf4j
@Component
public class PatternFactory {

    private final FeatureExtractor featureExtractor;
    private final HorizonProperties.Pattern config;

    public PatternFactory(FeatureExtractor featureExtractor, HorizonProperties horizonProperties) {
        this.featureExtractor = featureExtractor;
        this.config = horizonProperties.getPattern();
    }

    /**
     * Build candidate patterns. Emergence scores are left at zero for the
     * detector to fill in against its stored patterns.
     */
    public List<Pattern> candidates(DataStream stream, Instant now) {
        stream.validate();
        List<Double> normalized = featureExtractor.normalize(stream.getValues());
        List<List<Double>> segments = featureExtractor.segment(normalized,
                config.getSegmentSize(), config.getSegmentStep());

        Map<FeatureType, List<Feature>> clusters = new EnumMap<>(FeatureType.class);
        for (List<Double> segment : segments) {
            for (Feature feature : featureExtractor.extract(segment)) {
                clusters.computeIfAbsent(feature.featureType(), t -> new ArrayList<>()).add(feature);
            }
        }

        List<Pattern> candidates = new ArrayList<>();
        clusters.forEach((type, features) -> candidates.add(Pattern.builder()
                .id(UUID.randomUUID().toString())
                .features(List.copyOf(features))
                .patternType(classify(type, stream))
                .strength(strength(features))
                .emergenceScore(0.0)
                .scale(stream.getScale())
                .timestamp(now)
                .build()));

        log.debug("Built {} candidate patterns from {} segments", candidates.size(), segments.size());
        return candidates;
    }

    /**
     * Signature rules: frequency content is temporal; otherwise stream markers
     * decide, falling back to structural.
     */
    public PatternType classify(FeatureType clusterType, DataStream stream) {
        if (clusterType == FeatureType.FREQUENCY) {
            return PatternType.TEMPORAL;
        }
        if (clusterType == FeatureType.STATISTICAL) {
            if (stream.hasMarker(StreamMarker.SPATIAL_DISTRIBUTION)) {
                return PatternType.SPATIAL;
            }
            if (stream.hasMarker(StreamMarker.BEHAVIORAL_SIGNATURE)) {
                return PatternType.BEHAVIORAL;
            }
        }
        return PatternType.STRUCTURAL;
    }

    private double strength(List<Feature> features) {
        if (features.isEmpty()) {
            return 0.5;
        }
        double sum = 0.0;
        for (Feature feature : features) {
            sum += feature.strength();
        }
        return PatternStatistics.clamp(sum / features.size(), 0.0, 1.0);
    }
}
