package com.costwatch.analysis.forecast;

import java.util.List;
import java.util.Map;

/**
 * Output of one model.
 *
 * @param fitQuality R² on the training data, or {@code null} for models that do not report one
 * @param parameters fitted parameters, for inspection only
 */
public record ModelResult(
        ForecastModelType model,
        List<ForecastPoint> predictions,
        Reliability reliability,
        Double fitQuality,
        Map<String, Object> parameters
) {
    public ModelResult {
        predictions = List.copyOf(predictions);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public boolean hasPredictions() {
        return !predictions.isEmpty();
    }
}
