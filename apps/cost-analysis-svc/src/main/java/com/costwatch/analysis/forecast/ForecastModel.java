package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import java.time.LocalDate;

public interface ForecastModel {

    ForecastModelType type();

    /**
     * Fits the model on {@code history} and predicts one value per day for {@code horizon} days after
     * the last observation. Predictions are never negative.
     *
     * @throws ModelFitException when the history cannot be fitted
     */
    ModelResult fit(PreparedSeries history, int horizon);

    static LocalDate futureDate(PreparedSeries history, int step) {
        return history.lastDate().plusDays(step + 1L);
    }
}
