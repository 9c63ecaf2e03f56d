package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.SeriesStatistics;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ForecastEnsemble {

    private static final Logger log = LoggerFactory.getLogger(ForecastEnsemble.class);

    static final double DEFAULT_ACCURACY = 0.5d;
    static final double DEFAULT_CONFIDENCE = 0.5d;
    static final int SEASONAL_PERIOD = 7;

    /**
     * Weights every model with predictions by {@code accuracy * reliability multiplier}, normalised to 1,
     * and sums the per-day predictions and confidences with those weights.
     *
     * @throws NoViableModelException when no model produced predictions
     */
    public EnsembleForecast combine(List<ModelResult> results, Map<ForecastModelType, Double> accuracy, int horizon) {
        List<ModelResult> usable = results.stream().filter(ModelResult::hasPredictions).toList();
        if (usable.isEmpty()) {
            throw new NoViableModelException(results.stream().map(ModelResult::model).toList());
        }

        Map<ForecastModelType, Double> weights = weights(usable, accuracy);

        List<EnsemblePoint> predictions = new ArrayList<>(horizon);
        for (int day = 0; day < horizon; day++) {
            double value = 0d;
            double confidence = 0d;
            LocalDate date = null;
            Map<ForecastModelType, ModelContribution> contributors = new EnumMap<>(ForecastModelType.class);
            for (ModelResult result : usable) {
                double weight = weights.get(result.model());
                if (day < result.predictions().size()) {
                    ForecastPoint point = result.predictions().get(day);
                    value += point.value() * weight;
                    confidence += point.confidence() * weight;
                    date = date == null ? point.date() : date;
                    contributors.put(result.model(), new ModelContribution(point.value(), weight));
                } else {
                    contributors.put(result.model(), new ModelContribution(0d, weight));
                }
            }
            predictions.add(new EnsemblePoint(date, value, confidence, contributors));
        }

        double[] values = predictions.stream().mapToDouble(EnsemblePoint::value).toArray();
        double total = Arrays.stream(values).sum();
        double ensembleAccuracy = weights.entrySet().stream()
                .mapToDouble(entry -> accuracy.getOrDefault(entry.getKey(), DEFAULT_ACCURACY) * entry.getValue())
                .sum();
        TrendDirection trend = values.length == 0
                ? TrendDirection.STABLE
                : TrendDirection.between(values[0], values[values.length - 1]);

        log.info("Ensemble forecast combined {} models, accuracy {}", usable.size(), String.format("%.3f", ensembleAccuracy));
        return new EnsembleForecast(
                predictions,
                total,
                horizon == 0 ? 0d : total / horizon,
                trend,
                SeriesStatistics.coefficientOfVariation(values),
                seasonalityStrength(values),
                ensembleAccuracy,
                weights,
                usable.stream().map(ModelResult::model).toList()
        );
    }

    static Map<ForecastModelType, Double> weights(List<ModelResult> usable, Map<ForecastModelType, Double> accuracy) {
        Map<ForecastModelType, Double> weights = new EnumMap<>(ForecastModelType.class);
        double totalWeight = 0d;
        for (ModelResult result : usable) {
            double weight = accuracy.getOrDefault(result.model(), DEFAULT_ACCURACY)
                    * result.reliability().weightMultiplier();
            weights.put(result.model(), weight);
            totalWeight += weight;
        }
        if (totalWeight <= 0d) {
            double equal = 1d / usable.size();
            weights.replaceAll((model, weight) -> equal);
            return weights;
        }
        double normaliser = totalWeight;
        weights.replaceAll((model, weight) -> weight / normaliser);
        return weights;
    }

    /**
     * Share of variance found within the seven weekly phases, capped at 1. Zero below two full weeks or
     * for a flat series.
     */
    public static double seasonalityStrength(double[] values) {
        if (values.length < 2 * SEASONAL_PERIOD) {
            return 0d;
        }
        double seasonalVariance = 0d;
        for (int phase = 0; phase < SEASONAL_PERIOD; phase++) {
            List<Double> phaseValues = new ArrayList<>();
            for (int i = phase; i < values.length; i += SEASONAL_PERIOD) {
                phaseValues.add(values[i]);
            }
            if (phaseValues.size() > 1) {
                seasonalVariance += SeriesStatistics.variance(phaseValues.stream().mapToDouble(Double::doubleValue).toArray());
            }
        }
        double totalVariance = SeriesStatistics.variance(values);
        return totalVariance > 0d ? Math.min(1d, seasonalVariance / totalVariance) : 0d;
    }
}
