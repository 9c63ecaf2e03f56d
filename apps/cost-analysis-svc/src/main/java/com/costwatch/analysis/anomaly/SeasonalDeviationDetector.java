package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.PreparedPoint;
import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares each point with the mean of its weekday and the mean of its hour of day, using whichever
 * expectation is closer to the observation. With daily data every point shares hour 0, so the hourly
 * profile degenerates to the overall mean.
 */
@Component
public class SeasonalDeviationDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalDeviationDetector.class);

    static final int MIN_DATA_POINTS = 21;
    private static final double DEVIATION_SIGMA = 2d;
    private static final double MAX_CONFIDENCE_RATIO = 3d;

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.SEASONAL;
    }

    @Override
    public List<CandidateAnomaly> detect(PreparedSeries series, double threshold) {
        if (series.size() < MIN_DATA_POINTS) {
            return List.of();
        }
        double[] values = series.values();
        double deviationThreshold = SeriesStatistics.standardDeviation(values) * DEVIATION_SIGMA;
        if (deviationThreshold <= 0d) {
            return List.of();
        }
        Map<DayOfWeek, Double> weekly = profile(series, PreparedPoint::dayOfWeek, new EnumMap<>(DayOfWeek.class));
        Map<Integer, Double> hourly = profile(series, PreparedPoint::hourOfDay, new HashMap<>());
        double overallMean = SeriesStatistics.mean(values);

        List<CandidateAnomaly> anomalies = new ArrayList<>();
        for (PreparedPoint point : series.points()) {
            double value = point.value();
            double weeklyExpected = weekly.getOrDefault(point.dayOfWeek(), overallMean);
            double hourlyExpected = hourly.getOrDefault(point.hourOfDay(), overallMean);
            double expected = Math.abs(value - weeklyExpected) < Math.abs(value - hourlyExpected)
                    ? weeklyExpected
                    : hourlyExpected;
            double deviation = Math.abs(value - expected);
            if (deviation <= deviationThreshold) {
                continue;
            }
            double ratio = deviation / deviationThreshold;
            anomalies.add(new CandidateAnomaly(
                    point.index(),
                    value,
                    AnomalyAlgorithm.SEASONAL,
                    Math.min(ratio, MAX_CONFIDENCE_RATIO) / MAX_CONFIDENCE_RATIO,
                    Severity.fromRatio(ratio),
                    Map.of(
                            "expected", expected,
                            "deviation", deviation,
                            "weeklyExpected", weeklyExpected,
                            "dailyExpected", hourlyExpected,
                            "dayOfWeek", (double) point.dayOfWeek().getValue(),
                            "hourOfDay", (double) point.hourOfDay()
                    )
            ));
        }
        log.debug("Seasonal analysis detected {} anomalies", anomalies.size());
        return anomalies;
    }

    private static <K> Map<K, Double> profile(PreparedSeries series, Function<PreparedPoint, K> bucket, Map<K, Double> target) {
        Map<K, double[]> sums = new HashMap<>();
        for (PreparedPoint point : series.points()) {
            double[] acc = sums.computeIfAbsent(bucket.apply(point), key -> new double[2]);
            acc[0] += point.value();
            acc[1] += 1;
        }
        sums.forEach((key, acc) -> target.put(key, acc[0] / acc[1]));
        return target;
    }
}
