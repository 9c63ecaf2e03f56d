package com.costwatch.analysis.forecast;

import com.costwatch.analysis.CostRecordFixtures;
import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.TimeSeriesPreparer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class ForecastFixtures {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private ForecastFixtures() {
    }

    static PreparedSeries series(double... values) {
        return new TimeSeriesPreparer().prepare(CostRecordFixtures.daily("Total", values));
    }

    static List<ForecastModel> allModels() {
        return List.of(new LinearRegressionModel(), new PolynomialRegressionModel(), new HoltWintersModel(), new SeasonalPatternModel());
    }

    static ForecastingEngine engine(List<ForecastModel> models) {
        return new ForecastingEngine(models, new ModelAccuracyEstimator(), new ForecastEnsemble(),
                new ConfidenceIntervalCalculator(), new InsightGenerator(), CLOCK);
    }

    static ForecastingEngine engine() {
        return engine(allModels());
    }
}
