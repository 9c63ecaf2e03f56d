package com.costwatch.analysis.anomaly;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * A point flagged by one or more algorithms. {@code uniqueKey} ({@code date_label}) identifies the same
 * anomaly across overlapping detection runs.
 */
public record EnsembleAnomaly(
        String anomalyId,
        String uniqueKey,
        int seriesIndex,
        Instant timestamp,
        LocalDate date,
        String label,
        double value,
        List<AnomalyAlgorithm> algorithms,
        int algorithmCount,
        double confidence,
        Severity severity,
        boolean needsImmediateAlert,
        boolean realTime,
        Map<AnomalyAlgorithm, Map<String, Double>> algorithmStats,
        String organization,
        String region
) {
    public EnsembleAnomaly {
        algorithms = List.copyOf(algorithms);
        algorithmStats = Map.copyOf(algorithmStats);
    }

    public static String uniqueKey(LocalDate date, String label) {
        return date + "_" + label;
    }
}
