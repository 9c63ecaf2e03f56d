package com.costwatch.analysis.forecast;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a forecast request. Failures the caller can act on (too little history, no model could be
 * fitted) are reported here rather than thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastOutcome(
        Status status,
        ForecastReport forecast,
        String error,
        Integer requiredDataPoints,
        Integer actualDataPoints
) {
    public enum Status {
        OK,
        INSUFFICIENT_DATA,
        NO_VIABLE_MODEL
    }

    public static ForecastOutcome ok(ForecastReport forecast) {
        return new ForecastOutcome(Status.OK, forecast, null, null, null);
    }

    public static ForecastOutcome insufficientData(int required, int actual) {
        return new ForecastOutcome(Status.INSUFFICIENT_DATA, null,
                "Insufficient historical data (minimum " + required + " days required)", required, actual);
    }

    public static ForecastOutcome noViableModel(String message) {
        return new ForecastOutcome(Status.NO_VIABLE_MODEL, null, message, null, null);
    }

    public boolean success() {
        return status == Status.OK;
    }
}
