package com.gt.studyplanner.metrics;

import java.util.List;

public class Statistics {

    // variance this small relative to the magnitude of the values is floating point noise in the mean
    private static final double RELATIVE_VARIANCE_EPSILON = 1e-12;

    private Statistics() { }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }

        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    public static double sampleStdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0;
        }
        return Math.sqrt(sumOfSquaredDeviations(values) / (values.size() - 1));
    }

    public static double populationStdDev(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        return Math.sqrt(sumOfSquaredDeviations(values) / values.size());
    }

    /**
     * 100 minus the coefficient of variation as a percentage, floored at 0. 0 when there are fewer than two values
     * or the mean is 0.
     */
    public static double consistency(List<Double> values, boolean sample) {
        if (values.size() < 2) {
            return 0;
        }

        double mean = mean(values);
        if (mean == 0) {
            return 0;
        }

        double stdDev = sample ? sampleStdDev(values) : populationStdDev(values);
        return Math.max(0, 100 - (stdDev / mean) * 100);
    }

    /**
     * Pearson correlation of values against their index 0..n-1. Returns 0 when the values have no variance.
     */
    public static double correlationWithIndex(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0;
        }

        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);

        double covariance = 0;
        double xVariance = 0;
        double yVariance = 0;
        double ySquares = 0;
        boolean constant = true;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            double dy = values.get(i) - yMean;
            covariance += dx * dy;
            xVariance += dx * dx;
            yVariance += dy * dy;
            ySquares += values.get(i) * values.get(i);
            constant &= values.get(i).equals(values.get(0));
        }

        if (constant || yVariance <= RELATIVE_VARIANCE_EPSILON * ySquares) {
            return 0;
        }

        double denominator = Math.sqrt(xVariance * yVariance);
        return denominator <= 0 ? 0 : covariance / denominator;
    }

    public static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double sumOfSquaredDeviations(List<Double> values) {
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum;
    }
}
