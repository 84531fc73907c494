package com.z254.horizon.pattern;

import com.z254.horizon.domain.model.Feature;
import com.z254.horizon.domain.model.FeatureType;
import com.z254.horizon.domain.model.Pattern;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Distance-based similarity and correlation between patterns.
 * <p>
 * Each pattern is projected onto an aligned vector holding the mean feature
 * vector of every feature type (zeros where a type is absent). Feature
 * similarity is {@code 1 / (1 + euclideanDistance)}; similarity and
 * correlation then weight it by whether the pattern types match.
 */
@Component
public class PatternCorrelator {

    private static final int STATISTICAL_DIM = 4;
    private static final int FREQUENCY_DIM = 2;
    private static final int STRUCTURAL_DIM = 2;

    public double featureSimilarity(Pattern first, Pattern second) {
        double[] a = alignedVector(first.getFeatures());
        double[] b = alignedVector(second.getFeatures());
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return 1.0 / (1.0 + Math.sqrt(sum));
    }

    /**
     * Similarity in [0,1]; patterns of different type never exceed 0.3.
     */
    public double similarity(Pattern first, Pattern second) {
        double features = featureSimilarity(first, second);
        if (first.getPatternType() == second.getPatternType()) {
            return 0.5 + 0.5 * features;
        }
        return 0.3 * features;
    }

    /**
     * Correlation in [0,1]; same-type patterns start at 0.8.
     */
    public double correlation(Pattern first, Pattern second) {
        double features = featureSimilarity(first, second);
        if (first.getPatternType() == second.getPatternType()) {
            return 0.8 + 0.2 * features;
        }
        return 0.3 + 0.6 * features;
    }

    // ========== Private Helper Methods ==========

    private double[] alignedVector(List<Feature> features) {
        double[] vector = new double[STATISTICAL_DIM + FREQUENCY_DIM + STRUCTURAL_DIM];
        accumulate(features, FeatureType.STATISTICAL, vector, 0, STATISTICAL_DIM);
        accumulate(features, FeatureType.FREQUENCY, vector, STATISTICAL_DIM, FREQUENCY_DIM);
        accumulate(features, FeatureType.STRUCTURAL, vector, STATISTICAL_DIM + FREQUENCY_DIM, STRUCTURAL_DIM);
        return vector;
    }

    private void accumulate(List<Feature> features, FeatureType type, double[] target, int offset, int dim) {
        int count = 0;
        for (Feature feature : features) {
            if (feature.featureType() != type) {
                continue;
            }
            double[] v = feature.vector();
            for (int i = 0; i < dim && i < v.length; i++) {
                target[offset + i] += v[i];
            }
            count++;
        }
        if (count > 1) {
            for (int i = 0; i < dim; i++) {
                target[offset + i] /= count;
            }
        }
    }
}
