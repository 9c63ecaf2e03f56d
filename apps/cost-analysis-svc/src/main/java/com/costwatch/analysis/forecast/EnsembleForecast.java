package com.costwatch.analysis.forecast;

import java.util.List;
import java.util.Map;

/**
 * Weighted combination of the models that produced predictions.
 *
 * @param accuracy weighted model accuracy as a fraction
 */
public record EnsembleForecast(
        List<EnsemblePoint> predictions,
        double total,
        double averageDaily,
        TrendDirection trend,
        double volatility,
        double seasonality,
        double accuracy,
        Map<ForecastModelType, Double> weights,
        List<ForecastModelType> usedModels
) {
}
