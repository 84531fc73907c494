package com.z254.horizon.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Descriptive statistics over numeric samples. Variance is the population variance.
 */
public final class PatternStatistics {

    private PatternStatistics() {
    }

    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public static double variance(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.size();
    }

    public static double standardDeviation(Collection<Double> values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Third standardized moment, 0 for a constant series.
     */
    public static double skewness(Collection<Double> values) {
        double std = standardDeviation(values);
        if (values.isEmpty() || std == 0.0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow((v - mean) / std, 3);
        }
        return sum / values.size();
    }

    /**
     * Excess kurtosis (fourth standardized moment minus 3), 0 for a constant series.
     */
    public static double kurtosis(Collection<Double> values) {
        double std = standardDeviation(values);
        if (values.isEmpty() || std == 0.0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += Math.pow((v - mean) / std, 4);
        }
        return sum / values.size() - 3.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Successive differences of an ordered series.
     */
    public static List<Double> differences(List<Double> values) {
        List<Double> diffs = new ArrayList<>(Math.max(0, values.size() - 1));
        for (int i = 1; i < values.size(); i++) {
            diffs.add(values.get(i) - values.get(i - 1));
        }
        return diffs;
    }
}
