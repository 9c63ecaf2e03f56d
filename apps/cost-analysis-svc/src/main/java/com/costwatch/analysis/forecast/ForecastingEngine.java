package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fits the requested models on a prepared daily series and combines them into a report. Holds no state
 * between calls; caching and alerting live in {@link ForecastService}.
 */
@Component
public class ForecastingEngine {

    private static final Logger log = LoggerFactory.getLogger(ForecastingEngine.class);

    private final Map<ForecastModelType, ForecastModel> models;
    private final ModelAccuracyEstimator accuracyEstimator;
    private final ForecastEnsemble ensemble;
    private final ConfidenceIntervalCalculator intervalCalculator;
    private final InsightGenerator insightGenerator;
    private final Clock clock;

    public ForecastingEngine(
            List<ForecastModel> models,
            ModelAccuracyEstimator accuracyEstimator,
            ForecastEnsemble ensemble,
            ConfidenceIntervalCalculator intervalCalculator,
            InsightGenerator insightGenerator,
            Clock clock
    ) {
        this.models = new EnumMap<>(ForecastModelType.class);
        models.forEach(model -> this.models.put(model.type(), model));
        this.accuracyEstimator = accuracyEstimator;
        this.ensemble = ensemble;
        this.intervalCalculator = intervalCalculator;
        this.insightGenerator = insightGenerator;
        this.clock = clock;
    }

    /**
     * @throws NoViableModelException when every requested model fails to fit
     */
    public ForecastReport forecast(PreparedSeries history, ForecastOptions options) {
        log.info("Generating {}-day forecast for {} using {} models",
                options.horizon(), options.serviceName(), options.models().size());

        List<ModelResult> results = new ArrayList<>();
        Map<ForecastModelType, Double> accuracy = new EnumMap<>(ForecastModelType.class);
        for (ForecastModelType type : options.models()) {
            ForecastModel model = models.get(type);
            if (model == null) {
                log.warn("No forecast model registered for {}", type.id());
                continue;
            }
            try {
                ModelResult result = model.fit(history, options.horizon());
                double modelAccuracy = accuracyEstimator.accuracy(history, model, options.accuracyStrategy());
                results.add(result);
                accuracy.put(type, modelAccuracy);
            } catch (ModelFitException ex) {
                log.warn("Excluding {} model from ensemble: {}", type.id(), ex.getMessage());
            } catch (RuntimeException ex) {
                log.warn("Excluding {} model from ensemble after unexpected failure", type.id(), ex);
            }
        }
        if (results.isEmpty()) {
            throw new NoViableModelException(options.models());
        }

        EnsembleForecast combined = ensemble.combine(results, accuracy, options.horizon());
        List<ConfidenceInterval> intervals = intervalCalculator.calculate(history, combined, options.confidenceLevel());
        ForecastInsights insights = insightGenerator.generate(
                SeriesStatistics.mean(history.values()), combined, options.horizon());

        Map<ForecastModelType, ModelResult> individual = new EnumMap<>(ForecastModelType.class);
        results.forEach(result -> individual.put(result.model(), result));

        return new ForecastReport(
                options.serviceName(),
                options.horizon(),
                options.confidenceLevel(),
                clock.instant(),
                combined.predictions(),
                intervals,
                accuracy,
                combined.accuracy(),
                individual,
                insights,
                new ForecastReport.Summary(
                        combined.total(),
                        combined.averageDaily(),
                        combined.trend(),
                        combined.volatility(),
                        combined.seasonality()
                )
        );
    }
}
