package com.costwatch.analysis.controller;

import com.costwatch.analysis.forecast.ForecastOutcome;

/**
 * Carries a failed {@link ForecastOutcome} to the exception handler so it becomes a 422 response.
 */
public class ForecastUnavailableException extends RuntimeException {

    private final ForecastOutcome outcome;

    public ForecastUnavailableException(ForecastOutcome outcome) {
        super(outcome.error());
        this.outcome = outcome;
    }

    public ForecastOutcome outcome() {
        return outcome;
    }
}
