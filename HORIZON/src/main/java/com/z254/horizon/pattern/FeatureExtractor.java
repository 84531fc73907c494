package com.z254.horizon.pattern;

import com.z254.horizon.domain.model.Feature;
import com.z254.horizon.domain.model.FrequencyFeature;
import com.z254.horizon.domain.model.StatisticalFeature;
import com.z254.horizon.domain.model.StructuralFeature;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Normalizes a series, cuts it into overlapping windows and extracts
 * statistical, frequency and structural features from each window.
 */
@Component
public class FeatureExtractor {

    /**
     * Min-max scale to [0,1]. A constant series maps to 0.5.
     */
    public List<Double> normalize(List<Double> values) {
        if (values.isEmpty()) {
            return List.of();
        }
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;
        List<Double> normalized = new ArrayList<>(values.size());
        for (double v : values) {
            normalized.add(range == 0.0 ? 0.5 : (v - min) / range);
        }
        return normalized;
    }

    /**
     * Fixed-size windows advancing by {@code step}; the final window may be shorter.
     */
    public List<List<Double>> segment(List<Double> values, int size, int step) {
        List<List<Double>> segments = new ArrayList<>();
        for (int start = 0; start < values.size(); start += step) {
            int end = Math.min(start + size, values.size());
            segments.add(List.copyOf(values.subList(start, end)));
            if (end == values.size()) {
                break;
            }
        }
        return segments;
    }

    public List<Feature> extract(List<Double> segment) {
        return List.of(statistical(segment), frequency(segment), structural(segment));
    }

    public StatisticalFeature statistical(List<Double> segment) {
        return new StatisticalFeature(
                PatternStatistics.mean(segment),
                PatternStatistics.variance(segment),
                PatternStatistics.skewness(segment),
                PatternStatistics.kurtosis(segment));
    }

    /**
     * Dominant non-zero frequency and normalized Shannon entropy of the power
     * spectrum from a direct DFT of the mean-removed segment.
     */
    public FrequencyFeature frequency(List<Double> segment) {
        int n = segment.size();
        int bins = n / 2;
        if (bins < 1) {
            return new FrequencyFeature(0.0, 1.0);
        }
        double mean = PatternStatistics.mean(segment);
        double[] power = new double[bins];
        double total = 0.0;
        for (int k = 1; k <= bins; k++) {
            double re = 0.0;
            double im = 0.0;
            for (int t = 0; t < n; t++) {
                double angle = 2.0 * Math.PI * k * t / n;
                double x = segment.get(t) - mean;
                re += x * Math.cos(angle);
                im -= x * Math.sin(angle);
            }
            power[k - 1] = re * re + im * im;
            total += power[k - 1];
        }
        if (total <= 1e-12) {
            return new FrequencyFeature(0.0, 1.0);
        }

        int dominant = 0;
        double entropy = 0.0;
        for (int i = 0; i < bins; i++) {
            if (power[i] > power[dominant]) {
                dominant = i;
            }
            double p = power[i] / total;
            if (p > 0) {
                entropy -= p * Math.log(p);
            }
        }
        double normalizedEntropy = bins > 1 ? entropy / Math.log(bins) : 0.0;
        return new FrequencyFeature((dominant + 1) / (double) n,
                PatternStatistics.clamp(normalizedEntropy, 0.0, 1.0));
    }

    public StructuralFeature structural(List<Double> segment) {
        if (segment.isEmpty()) {
            return new StructuralFeature(0.0, 1.0);
        }
        double complexity = new HashSet<>(segment).size() / (double) segment.size();
        double regularity = Math.exp(-PatternStatistics.variance(PatternStatistics.differences(segment)));
        return new StructuralFeature(complexity, regularity);
    }
}
