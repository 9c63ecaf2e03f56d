package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.TimeSeriesPreparer;
import java.util.EnumSet;
import java.util.List;

/**
 * Every knob of a detection run. Algorithms are normalised to declaration order so the ensemble sees
 * candidates in the same order regardless of how the caller listed them.
 */
public record AnomalyDetectionOptions(
        double threshold,
        List<AnomalyAlgorithm> algorithms,
        int minDataPoints,
        boolean realTime
) {
    public static final double DEFAULT_THRESHOLD = 2.5d;

    public AnomalyDetectionOptions {
        if (!(threshold > 0d)) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (algorithms == null || algorithms.isEmpty()) {
            throw new IllegalArgumentException("at least one anomaly algorithm must be selected");
        }
        if (minDataPoints < 1) {
            throw new IllegalArgumentException("minDataPoints must be positive");
        }
        algorithms = List.copyOf(EnumSet.copyOf(algorithms));
    }

    public static AnomalyDetectionOptions defaults() {
        return new AnomalyDetectionOptions(
                DEFAULT_THRESHOLD,
                List.of(AnomalyAlgorithm.values()),
                TimeSeriesPreparer.ANOMALY_MIN_DATA_POINTS,
                false);
    }

    public AnomalyDetectionOptions withThreshold(double newThreshold) {
        return new AnomalyDetectionOptions(newThreshold, algorithms, minDataPoints, realTime);
    }

    public AnomalyDetectionOptions withRealTime(boolean newRealTime) {
        return new AnomalyDetectionOptions(threshold, algorithms, minDataPoints, newRealTime);
    }

    public AnomalyDetectionOptions withMinDataPoints(int newMinDataPoints) {
        return new AnomalyDetectionOptions(threshold, algorithms, newMinDataPoints, realTime);
    }
}
