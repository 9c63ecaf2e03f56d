package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Component;

/**
 * Least-squares polynomial of degree {@code min(3, n / 10)} over the series index.
 */
@Component
public class PolynomialRegressionModel implements ForecastModel {

    static final int MAX_DEGREE = 3;
    static final double MAX_CONFIDENCE = 0.95d;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.POLYNOMIAL;
    }

    static int degreeFor(int size) {
        return Math.min(MAX_DEGREE, size / 10);
    }

    @Override
    public ModelResult fit(PreparedSeries history, int horizon) {
        double[] values = history.values();
        if (values.length == 0) {
            throw new ModelFitException(type(), "history is empty");
        }
        int degree = degreeFor(values.length);
        double[] coefficients = coefficients(values, degree);

        double[] fitted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            fitted[i] = evaluate(coefficients, i);
        }
        double r2 = SeriesStatistics.rSquared(values, fitted);
        double confidence = Math.min(r2, MAX_CONFIDENCE);

        List<ForecastPoint> predictions = new ArrayList<>(horizon);
        for (int step = 0; step < horizon; step++) {
            double value = Math.max(0d, evaluate(coefficients, values.length + step));
            predictions.add(new ForecastPoint(ForecastModel.futureDate(history, step), value, confidence));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("degree", degree);
        parameters.put("coefficients", Arrays.stream(coefficients).boxed().toList());
        return new ModelResult(type(), predictions, Reliability.fromFit(r2, 0.8d, 0.6d), r2, parameters);
    }

    /**
     * Coefficients in ascending power order, intercept first.
     */
    private double[] coefficients(double[] values, int degree) {
        if (degree == 0) {
            return new double[] {SeriesStatistics.mean(values)};
        }
        if (values.length <= degree + 1) {
            throw new ModelFitException(type(), "not enough observations for degree " + degree);
        }
        double[][] powers = new double[values.length][degree];
        for (int i = 0; i < values.length; i++) {
            for (int power = 1; power <= degree; power++) {
                powers[i][power - 1] = Math.pow(i, power);
            }
        }
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.newSampleData(values, powers);
            double[] coefficients = regression.estimateRegressionParameters();
            for (double coefficient : coefficients) {
                if (!Double.isFinite(coefficient)) {
                    throw new ModelFitException(type(), "non-finite coefficient");
                }
            }
            return coefficients;
        } catch (IllegalArgumentException ex) {
            // SingularMatrixException and the other commons-math argument errors
            throw new ModelFitException(type(), ex.getMessage(), ex);
        }
    }

    private static double evaluate(double[] coefficients, double x) {
        double value = 0d;
        for (int power = 0; power < coefficients.length; power++) {
            value += coefficients[power] * Math.pow(x, power);
        }
        return value;
    }
}
