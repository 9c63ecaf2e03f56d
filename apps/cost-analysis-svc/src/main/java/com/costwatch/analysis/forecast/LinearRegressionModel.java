package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

/**
 * Ordinary least squares of value against series index, extrapolated past the last observation.
 */
@Component
public class LinearRegressionModel implements ForecastModel {

    @Override
    public ForecastModelType type() {
        return ForecastModelType.LINEAR;
    }

    @Override
    public ModelResult fit(PreparedSeries history, int horizon) {
        if (history.size() < 2) {
            throw new ModelFitException(type(), "at least two observations are required");
        }
        double[] values = history.values();
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
            throw new ModelFitException(type(), "regression did not converge");
        }

        double[] fitted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            fitted[i] = intercept + slope * i;
        }
        double r2 = SeriesStatistics.rSquared(values, fitted);

        List<ForecastPoint> predictions = new ArrayList<>(horizon);
        for (int step = 0; step < horizon; step++) {
            double value = Math.max(0d, intercept + slope * (values.length + step));
            predictions.add(new ForecastPoint(ForecastModel.futureDate(history, step), value, r2));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("slope", slope);
        parameters.put("intercept", intercept);
        parameters.put("trend", slope > 0 ? TrendDirection.INCREASING.id() : TrendDirection.DECREASING.id());
        return new ModelResult(type(), predictions, Reliability.fromFit(r2, 0.7d, 0.4d), r2, parameters);
    }
}
