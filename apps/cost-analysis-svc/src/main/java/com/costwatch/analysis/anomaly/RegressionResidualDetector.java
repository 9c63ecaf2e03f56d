package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RegressionResidualDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(RegressionResidualDetector.class);

    static final int MIN_DATA_POINTS = 10;
    private static final double RESIDUAL_SIGMA = 2d;
    private static final double MAX_CONFIDENCE_RATIO = 4d;

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.REGRESSION;
    }

    @Override
    public List<CandidateAnomaly> detect(PreparedSeries series, double threshold) {
        double[] values = series.values();
        if (values.length < MIN_DATA_POINTS) {
            return List.of();
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double[] predicted = new double[values.length];
        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            predicted[i] = regression.predict(i);
            residuals[i] = Math.abs(values[i] - predicted[i]);
        }
        double residualThreshold = SeriesStatistics.mean(residuals)
                + RESIDUAL_SIGMA * SeriesStatistics.standardDeviation(residuals);
        if (!(residualThreshold > 0d)) {
            return List.of();
        }

        List<CandidateAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < residuals.length; i++) {
            if (residuals[i] <= residualThreshold) {
                continue;
            }
            double ratio = residuals[i] / residualThreshold;
            anomalies.add(new CandidateAnomaly(
                    i,
                    values[i],
                    AnomalyAlgorithm.REGRESSION,
                    Math.min(ratio, MAX_CONFIDENCE_RATIO) / MAX_CONFIDENCE_RATIO,
                    Severity.fromRatio(ratio),
                    Map.of(
                            "predicted", predicted[i],
                            "residual", residuals[i],
                            "residualThreshold", residualThreshold,
                            "slope", regression.getSlope()
                    )
            ));
        }
        log.debug("Regression detected {} anomalies", anomalies.size());
        return anomalies;
    }
}
