package com.costwatch.analysis.forecast;

import com.costwatch.analysis.cache.FingerprintCache;
import com.costwatch.analysis.cache.SeriesFingerprint;
import com.costwatch.analysis.config.CostwatchProperties;
import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.monitoring.AlertPublisher;
import com.costwatch.analysis.series.DailyCostAggregator;
import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.TimeSeriesPreparer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final ForecastingEngine engine;
    private final TimeSeriesPreparer preparer;
    private final DailyCostAggregator aggregator;
    private final AlertPublisher alertPublisher;
    private final CostwatchProperties.Forecast settings;
    private final FingerprintCache<ForecastReport> cache;

    public ForecastService(
            ForecastingEngine engine,
            TimeSeriesPreparer preparer,
            DailyCostAggregator aggregator,
            AlertPublisher alertPublisher,
            CostwatchProperties properties,
            FingerprintCache<ForecastReport> forecastCache
    ) {
        this.engine = engine;
        this.preparer = preparer;
        this.aggregator = aggregator;
        this.alertPublisher = alertPublisher;
        this.settings = properties.forecast();
        this.cache = forecastCache;
    }

    /**
     * Forecasts the daily cost of {@code options.serviceName()}, or of all services for {@code Total}.
     *
     * @throws IllegalArgumentException when horizon or confidence level fall outside the configured range
     */
    public ForecastOutcome generateForecast(List<CostRecord> records, ForecastOptions options) {
        settings.validate(options);
        PreparedSeries history = preparer.prepare(aggregator.aggregate(records, options.serviceName()));
        if (history.size() < settings.minDataPoints()) {
            log.info("Insufficient data for {} forecast: {} < {} required",
                    options.serviceName(), history.size(), settings.minDataPoints());
            return ForecastOutcome.insufficientData(settings.minDataPoints(), history.size());
        }

        String fingerprint = SeriesFingerprint.of(history,
                options.serviceName(), options.horizon(), options.confidenceLevel(),
                options.models(), options.accuracyStrategy());
        ForecastReport report;
        try {
            report = cache.getOrCompute(fingerprint, () -> engine.forecast(history, options));
        } catch (NoViableModelException ex) {
            log.warn("Forecast for {} failed: {}", options.serviceName(), ex.getMessage());
            return ForecastOutcome.noViableModel(ex.getMessage());
        }

        if (options.realTime() && !report.insights().significantChanges().isEmpty()) {
            notifyForecastChange(report);
        }
        return ForecastOutcome.ok(report);
    }

    /**
     * One forecast per request; requests that fail are reported alongside the successful ones.
     *
     * @throws IllegalArgumentException when the batch is empty or larger than the configured maximum
     */
    public BatchForecastResult generateBatch(List<CostRecord> records, List<ForecastOptions> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("Services array is required for batch forecasting");
        }
        if (requests.size() > settings.maxBatchSize()) {
            throw new IllegalArgumentException(
                    "Maximum " + settings.maxBatchSize() + " services allowed per batch request");
        }
        requests.forEach(settings::validate);

        List<BatchForecastResult.Entry> successful = new ArrayList<>();
        List<BatchForecastResult.Entry> failed = new ArrayList<>();
        for (ForecastOptions request : requests) {
            ForecastOutcome outcome = generateForecast(records, request);
            BatchForecastResult.Entry entry = new BatchForecastResult.Entry(request.serviceName(), outcome);
            if (outcome.success()) {
                successful.add(entry);
            } else {
                failed.add(entry);
            }
        }
        double averageAccuracy = successful.stream()
                .mapToDouble(entry -> entry.outcome().forecast().ensembleAccuracy())
                .average()
                .orElse(0d);
        log.info("Batch forecast complete: {}/{} successful", successful.size(), requests.size());
        return new BatchForecastResult(successful, failed,
                new BatchForecastResult.Summary(requests.size(), successful.size(), failed.size(), averageAccuracy));
    }

    private void notifyForecastChange(ForecastReport report) {
        try {
            alertPublisher.publishForecastChange(report);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish forecast change for {}", report.serviceName(), ex);
        }
    }
}
