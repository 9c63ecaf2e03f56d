package com.costwatch.analysis.controller.dto;

import com.costwatch.analysis.anomaly.AnomalyAlgorithm;
import com.costwatch.analysis.forecast.AccuracyStrategy;
import com.costwatch.analysis.forecast.ForecastModelType;
import java.util.List;

public record CapabilitiesResponseDto(
        List<ForecastModelType> algorithms,
        List<AnomalyAlgorithm> anomalyAlgorithms,
        List<AccuracyStrategy> accuracyStrategies,
        int minHorizon,
        int maxHorizon,
        int minDataPoints,
        int maxBatchSize,
        int maxScenarios,
        ConfidenceRangeDto confidenceRange
) {
    public record ConfidenceRangeDto(double min, double max) {
    }
}
