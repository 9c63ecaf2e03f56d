package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rolling z-score: each point is scored against the mean and standard deviation of the window
 * immediately before it.
 */
@Component
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreDetector.class);

    private static final int MAX_WINDOW = 14;
    private static final double MAX_CONFIDENCE_RATIO = 5d;

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.ZSCORE;
    }

    @Override
    public List<CandidateAnomaly> detect(PreparedSeries series, double threshold) {
        double[] values = series.values();
        int windowSize = Math.min(MAX_WINDOW, values.length / 2);
        if (windowSize < 1) {
            return List.of();
        }
        List<CandidateAnomaly> anomalies = new ArrayList<>();
        for (int i = windowSize; i < values.length; i++) {
            double[] window = Arrays.copyOfRange(values, i - windowSize, i);
            double mean = SeriesStatistics.mean(window);
            double stdDev = SeriesStatistics.standardDeviation(window);
            if (stdDev <= 0d) {
                continue;
            }
            double zScore = Math.abs((values[i] - mean) / stdDev);
            if (zScore > threshold) {
                anomalies.add(new CandidateAnomaly(
                        i,
                        values[i],
                        AnomalyAlgorithm.ZSCORE,
                        confidenceFor(zScore, threshold),
                        Severity.fromRatio(zScore / threshold),
                        Map.of("zScore", zScore, "mean", mean, "stdDev", stdDev)
                ));
            }
        }
        log.debug("Z-score detected {} anomalies (window {})", anomalies.size(), windowSize);
        return anomalies;
    }

    static double confidenceFor(double zScore, double threshold) {
        return Math.min(zScore / threshold, MAX_CONFIDENCE_RATIO) / MAX_CONFIDENCE_RATIO;
    }
}
