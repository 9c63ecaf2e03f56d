package com.costwatch.analysis.series;

import java.util.Arrays;

/**
 * Population statistics over plain arrays. Degenerate inputs (empty arrays, zero variance, zero mean)
 * resolve to neutral values instead of NaN.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double variance(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double mean = mean(values);
        double sum = 0d;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Standard deviation relative to the mean; 0 when the mean is 0.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0d) {
            return 0d;
        }
        return standardDeviation(values) / mean;
    }

    /**
     * Nearest-rank quantile over already sorted values. When {@code n * p} lands exactly on a rank of an
     * even-sized sample, the two neighbouring values are averaged.
     */
    public static double quantileSorted(double[] sorted, double p) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("quantile requires at least one value");
        }
        if (p < 0d || p > 1d) {
            throw new IllegalArgumentException("quantile must be between 0 and 1");
        }
        if (p == 1d) {
            return sorted[sorted.length - 1];
        }
        if (p == 0d) {
            return sorted[0];
        }
        double idx = sorted.length * p;
        if (idx % 1 != 0) {
            return sorted[(int) Math.ceil(idx) - 1];
        }
        int rank = (int) idx;
        if (sorted.length % 2 == 0) {
            return (sorted[rank - 1] + sorted[rank]) / 2d;
        }
        return sorted[rank];
    }

    public static double quantile(double[] values, double p) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return quantileSorted(sorted, p);
    }

    /**
     * Coefficient of determination, floored at 0. A constant series is explained perfectly when the
     * residuals vanish and not at all otherwise.
     */
    public static double rSquared(double[] actual, double[] predicted) {
        double mean = mean(actual);
        double totalSumSquares = 0d;
        double residualSumSquares = 0d;
        for (int i = 0; i < actual.length; i++) {
            totalSumSquares += (actual[i] - mean) * (actual[i] - mean);
            residualSumSquares += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
        }
        if (totalSumSquares == 0d) {
            return residualSumSquares < 1e-9 ? 1d : 0d;
        }
        return Math.max(0d, 1d - residualSumSquares / totalSumSquares);
    }
}
