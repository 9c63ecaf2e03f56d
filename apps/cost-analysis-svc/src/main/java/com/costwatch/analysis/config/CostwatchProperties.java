package com.costwatch.analysis.config;

import com.costwatch.analysis.anomaly.AnomalyAlgorithm;
import com.costwatch.analysis.anomaly.AnomalyDetectionOptions;
import com.costwatch.analysis.forecast.AccuracyStrategy;
import com.costwatch.analysis.forecast.ForecastModelType;
import com.costwatch.analysis.forecast.ForecastOptions;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "costwatch")
public record CostwatchProperties(
        Anomaly anomaly,
        Forecast forecast,
        Cache cache,
        Monitoring monitoring
) {

    @ConstructorBinding
    public CostwatchProperties {
        // every section is optional; missing ones fall back to the documented defaults
        if (anomaly == null) {
            anomaly = new Anomaly(null, null, null, null, null);
        }
        if (forecast == null) {
            forecast = new Forecast(null, null, null, null, null, null, null, null, null, null, null);
        }
        if (cache == null) {
            cache = new Cache(null, null);
        }
        if (monitoring == null) {
            monitoring = new Monitoring(null, null, null, null, null);
        }
    }

    public static CostwatchProperties defaults() {
        return new CostwatchProperties(null, null, null, null);
    }

    public record Anomaly(
            Double threshold,
            List<AnomalyAlgorithm> algorithms,
            Integer minDataPoints,
            Integer reportLimit,
            Integer topServices
    ) {
        public Anomaly {
            if (threshold == null) {
                threshold = AnomalyDetectionOptions.DEFAULT_THRESHOLD;
            }
            if (algorithms == null || algorithms.isEmpty()) {
                algorithms = List.of(AnomalyAlgorithm.values());
            }
            if (minDataPoints == null) {
                minDataPoints = 7;
            }
            if (reportLimit == null) {
                reportLimit = 50;
            }
            if (topServices == null) {
                topServices = 5;
            }
            if (threshold <= 0) {
                throw new IllegalArgumentException("anomaly threshold must be positive");
            }
            if (reportLimit <= 0 || topServices <= 0) {
                throw new IllegalArgumentException("reportLimit and topServices must be positive");
            }
        }

        public AnomalyDetectionOptions toOptions() {
            return new AnomalyDetectionOptions(threshold, algorithms, minDataPoints, false);
        }
    }

    public record Forecast(
            Integer horizon,
            Double confidenceLevel,
            List<ForecastModelType> models,
            Integer minDataPoints,
            Integer minHorizon,
            Integer maxHorizon,
            Double minConfidence,
            Double maxConfidence,
            AccuracyStrategy accuracyStrategy,
            Integer maxBatchSize,
            Integer maxScenarios
    ) {
        public Forecast {
            if (horizon == null) {
                horizon = ForecastOptions.DEFAULT_HORIZON;
            }
            if (confidenceLevel == null) {
                confidenceLevel = ForecastOptions.DEFAULT_CONFIDENCE_LEVEL;
            }
            if (models == null || models.isEmpty()) {
                models = List.of(ForecastModelType.values());
            }
            if (minDataPoints == null) {
                minDataPoints = 14;
            }
            if (minHorizon == null) {
                minHorizon = 7;
            }
            if (maxHorizon == null) {
                maxHorizon = 365;
            }
            if (minConfidence == null) {
                minConfidence = 0.80;
            }
            if (maxConfidence == null) {
                maxConfidence = 0.99;
            }
            if (accuracyStrategy == null) {
                accuracyStrategy = AccuracyStrategy.ESTIMATED;
            }
            if (maxBatchSize == null) {
                maxBatchSize = 10;
            }
            if (maxScenarios == null) {
                maxScenarios = 5;
            }
            if (minHorizon > maxHorizon) {
                throw new IllegalArgumentException("minHorizon must not exceed maxHorizon");
            }
            if (minConfidence > maxConfidence) {
                throw new IllegalArgumentException("minConfidence must not exceed maxConfidence");
            }
        }

        public ForecastOptions toOptions() {
            return new ForecastOptions(horizon, confidenceLevel, ForecastOptions.TOTAL_SERVICE, models, false, accuracyStrategy);
        }

        /**
         * @throws IllegalArgumentException when the request falls outside the configured horizon or
         *                                  confidence range
         */
        public void validate(ForecastOptions options) {
            if (options.horizon() < minHorizon || options.horizon() > maxHorizon) {
                throw new IllegalArgumentException(
                        "Forecast horizon must be between " + minHorizon + " and " + maxHorizon + " days");
            }
            if (options.confidenceLevel() < minConfidence || options.confidenceLevel() > maxConfidence) {
                throw new IllegalArgumentException(
                        "Confidence level must be between " + minConfidence + " and " + maxConfidence);
            }
        }
    }

    public record Cache(Duration ttl, Integer maxEntries) {
        public Cache {
            if (ttl == null) {
                ttl = Duration.ofMinutes(15);
            }
            if (maxEntries == null) {
                maxEntries = 256;
            }
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("cache ttl must be positive");
            }
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("cache maxEntries must be positive");
            }
        }
    }

    public record Monitoring(Boolean enabled, String cron, Integer lookbackDays, Integer minRecords, Integer minDataPoints) {
        public Monitoring {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (cron == null || cron.isBlank()) {
                cron = "0 */15 * * * *";
            }
            if (lookbackDays == null) {
                lookbackDays = 7;
            }
            if (minRecords == null) {
                minRecords = 10;
            }
            if (minDataPoints == null) {
                minDataPoints = 5;
            }
            if (lookbackDays <= 0) {
                throw new IllegalArgumentException("lookbackDays must be positive");
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }
}
