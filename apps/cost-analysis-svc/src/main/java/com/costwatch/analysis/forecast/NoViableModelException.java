package com.costwatch.analysis.forecast;

import java.util.List;

/**
 * Every requested model failed or produced no predictions.
 */
public class NoViableModelException extends RuntimeException {

    private final List<ForecastModelType> attempted;

    public NoViableModelException(List<ForecastModelType> attempted) {
        super("No forecasting model produced predictions (attempted: " + attempted + ")");
        this.attempted = List.copyOf(attempted);
    }

    public List<ForecastModelType> attempted() {
        return attempted;
    }
}
