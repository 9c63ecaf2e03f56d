package com.costwatch.analysis.anomaly;

import java.util.Map;

/**
 * A point flagged by a single algorithm. {@code stats} holds the algorithm's own numbers
 * (z-score, bounds, residual, expected value, ...).
 */
public record CandidateAnomaly(
        int seriesIndex,
        double value,
        AnomalyAlgorithm algorithm,
        double confidence,
        Severity severity,
        Map<String, Double> stats
) {
    public CandidateAnomaly {
        stats = Map.copyOf(stats);
    }
}
