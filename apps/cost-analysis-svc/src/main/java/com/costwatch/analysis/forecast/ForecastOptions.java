package com.costwatch.analysis.forecast;

import java.util.EnumSet;
import java.util.List;

/**
 * Every knob of a forecast run. Range checks against the configured horizon and confidence limits
 * happen in {@code CostwatchProperties.Forecast#validate}; this record only rejects values that can never work.
 */
public record ForecastOptions(
        int horizon,
        double confidenceLevel,
        String serviceName,
        List<ForecastModelType> models,
        boolean realTime,
        AccuracyStrategy accuracyStrategy
) {
    public static final int DEFAULT_HORIZON = 90;
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95d;
    public static final String TOTAL_SERVICE = "Total";

    public ForecastOptions {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be at least one day");
        }
        if (!(confidenceLevel > 0d && confidenceLevel < 1d)) {
            throw new IllegalArgumentException("confidenceLevel must be between 0 and 1");
        }
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("at least one forecast model must be selected");
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = TOTAL_SERVICE;
        }
        if (accuracyStrategy == null) {
            accuracyStrategy = AccuracyStrategy.ESTIMATED;
        }
        models = List.copyOf(EnumSet.copyOf(models));
    }

    public static ForecastOptions defaults() {
        return new ForecastOptions(DEFAULT_HORIZON, DEFAULT_CONFIDENCE_LEVEL, TOTAL_SERVICE,
                List.of(ForecastModelType.values()), false, AccuracyStrategy.ESTIMATED);
    }

    public ForecastOptions withHorizon(int newHorizon) {
        return new ForecastOptions(newHorizon, confidenceLevel, serviceName, models, realTime, accuracyStrategy);
    }

    public ForecastOptions withServiceName(String newServiceName) {
        return new ForecastOptions(horizon, confidenceLevel, newServiceName, models, realTime, accuracyStrategy);
    }

    public ForecastOptions withModels(List<ForecastModelType> newModels) {
        return new ForecastOptions(horizon, confidenceLevel, serviceName, newModels, realTime, accuracyStrategy);
    }

    public ForecastOptions withConfidenceLevel(double newConfidenceLevel) {
        return new ForecastOptions(horizon, newConfidenceLevel, serviceName, models, realTime, accuracyStrategy);
    }

    public ForecastOptions withAccuracyStrategy(AccuracyStrategy newStrategy) {
        return new ForecastOptions(horizon, confidenceLevel, serviceName, models, realTime, newStrategy);
    }
}
