package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Bands of {@code z * stddev(history) * (1 + 0.5 * day / horizon)} around each ensemble prediction.
 * The lower bound never goes below zero. The margin grows with the day index, but once the lower bound
 * is clamped the band is {@code [0, upper]}, so a falling forecast can narrow it.
 */
@Component
public class ConfidenceIntervalCalculator {

    static final double TIME_DECAY = 0.5d;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0d, 1d);

    public List<ConfidenceInterval> calculate(PreparedSeries history, EnsembleForecast forecast, double confidenceLevel) {
        double stdDev = SeriesStatistics.standardDeviation(history.values());
        double z = zScore(confidenceLevel);
        List<EnsemblePoint> predictions = forecast.predictions();
        List<ConfidenceInterval> intervals = new ArrayList<>(predictions.size());
        for (int day = 0; day < predictions.size(); day++) {
            EnsemblePoint point = predictions.get(day);
            double margin = z * stdDev * timeDecay(day, predictions.size());
            intervals.add(new ConfidenceInterval(
                    point.date(),
                    point.value(),
                    Math.max(0d, point.value() - margin),
                    point.value() + margin,
                    point.confidence()
            ));
        }
        return intervals;
    }

    static double timeDecay(int day, int horizon) {
        return 1d + ((double) day / horizon) * TIME_DECAY;
    }

    /**
     * Two-sided critical value. The common 90% and 95% levels use their textbook constants.
     */
    public static double zScore(double confidenceLevel) {
        if (confidenceLevel == 0.95d) {
            return 1.96d;
        }
        if (confidenceLevel == 0.90d) {
            return 1.645d;
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(1d - (1d - confidenceLevel) / 2d);
    }
}
