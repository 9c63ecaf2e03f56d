package com.costwatch.analysis.forecast;

public class ModelFitException extends RuntimeException {

    private final ForecastModelType model;

    public ModelFitException(ForecastModelType model, String message) {
        super(model.id() + " model fit failed: " + message);
        this.model = model;
    }

    public ModelFitException(ForecastModelType model, String message, Throwable cause) {
        super(model.id() + " model fit failed: " + message, cause);
        this.model = model;
    }

    public ForecastModelType model() {
        return model;
    }
}
