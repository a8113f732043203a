package com.costwatch.anomaly.detection;

import java.util.Arrays;

/**
 * Outlier resistant summary statistics over small daily cost vectors.
 */
public final class RobustStatistics {

    private RobustStatistics() {
    }

    /**
     * Middle value of {@code values}; the mean of the two middle values for even lengths.
     */
    public static double median(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("median requires at least one value");
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        return (sorted[middle - 1] + sorted[middle]) / 2.0d;
    }

    /**
     * Median absolute deviation around the median of {@code values}.
     */
    public static double mad(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * Theil-Sen estimator: the median of the slopes between every pair of points, with
     * the array index as the x coordinate.
     */
    public static double theilSenSlope(double[] values) {
        if (values == null || values.length < 2) {
            throw new IllegalArgumentException("slope requires at least two values");
        }
        int n = values.length;
        double[] slopes = new double[n * (n - 1) / 2];
        int k = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                slopes[k++] = (values[j] - values[i]) / (j - i);
            }
        }
        return median(slopes);
    }
}
