package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedPoint;
import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Projects the series mean through weekday and week-of-month multipliers plus a linear trend.
 */
@Component
public class SeasonalPatternModel implements ForecastModel {

    static final double WEEKLY_WEIGHT = 0.7d;
    static final double MONTHLY_WEIGHT = 0.3d;
    static final double CONFIDENCE = 0.75d;
    static final int MONTH_BUCKETS = 4;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.SEASONAL;
    }

    @Override
    public ModelResult fit(PreparedSeries history, int horizon) {
        if (history.isEmpty()) {
            throw new ModelFitException(type(), "history is empty");
        }
        double[] values = history.values();
        double mean = SeriesStatistics.mean(values);
        Map<DayOfWeek, Double> weekly = weeklyPattern(history, mean);
        double[] monthly = monthlyPattern(history, mean);
        double trend = slope(values);

        List<ForecastPoint> predictions = new ArrayList<>(horizon);
        for (int step = 0; step < horizon; step++) {
            LocalDate date = ForecastModel.futureDate(history, step);
            double weeklyMultiplier = weekly.get(date.getDayOfWeek());
            double monthlyMultiplier = monthMultiplier(monthly, date.getDayOfMonth());
            double seasonal = mean * (weeklyMultiplier * WEEKLY_WEIGHT + monthlyMultiplier * MONTHLY_WEIGHT);
            double value = Math.max(0d, seasonal + trend * (step + 1));
            predictions.add(new ForecastPoint(date, value, CONFIDENCE));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("weeklyPattern", weekly);
        parameters.put("monthlyPattern", Arrays.stream(monthly).boxed().toList());
        parameters.put("trend", trend);
        return new ModelResult(type(), predictions, Reliability.MEDIUM, null, parameters);
    }

    /**
     * Mean per weekday relative to the overall mean; weekdays without data, or a zero overall mean, map to 1.
     */
    static Map<DayOfWeek, Double> weeklyPattern(PreparedSeries history, double mean) {
        Map<DayOfWeek, double[]> sums = new EnumMap<>(DayOfWeek.class);
        for (PreparedPoint point : history.points()) {
            double[] acc = sums.computeIfAbsent(point.dayOfWeek(), key -> new double[2]);
            acc[0] += point.value();
            acc[1]++;
        }
        Map<DayOfWeek, Double> pattern = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            double[] acc = sums.get(day);
            pattern.put(day, acc == null || mean == 0d ? 1d : (acc[0] / acc[1]) / mean);
        }
        return pattern;
    }

    /**
     * Multipliers for days 1-7, 8-14, 15-21 and 22-28 of the month.
     */
    static double[] monthlyPattern(PreparedSeries history, double mean) {
        double[] sums = new double[MONTH_BUCKETS];
        int[] counts = new int[MONTH_BUCKETS];
        for (PreparedPoint point : history.points()) {
            int bucket = (point.dayOfMonth() - 1) / 7;
            if (bucket < MONTH_BUCKETS) {
                sums[bucket] += point.value();
                counts[bucket]++;
            }
        }
        double[] pattern = new double[MONTH_BUCKETS];
        for (int bucket = 0; bucket < MONTH_BUCKETS; bucket++) {
            pattern[bucket] = counts[bucket] == 0 || mean == 0d ? 1d : (sums[bucket] / counts[bucket]) / mean;
        }
        return pattern;
    }

    // days 29-31 carry no monthly effect
    private static double monthMultiplier(double[] monthly, int dayOfMonth) {
        int bucket = (dayOfMonth - 1) / 7;
        return bucket < monthly.length ? monthly[bucket] : 1d;
    }

    static double slope(double[] values) {
        double meanIndex = (values.length - 1) / 2d;
        double meanValue = SeriesStatistics.mean(values);
        double numerator = 0d;
        double denominator = 0d;
        for (int i = 0; i < values.length; i++) {
            numerator += (i - meanIndex) * (values[i] - meanValue);
            denominator += (i - meanIndex) * (i - meanIndex);
        }
        return denominator != 0d ? numerator / denominator : 0d;
    }
}
