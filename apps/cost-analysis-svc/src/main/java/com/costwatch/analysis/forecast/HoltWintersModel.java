package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Triple exponential smoothing with a multiplicative weekly season and fixed smoothing constants.
 */
@Component
public class HoltWintersModel implements ForecastModel {

    static final double ALPHA = 0.3d;
    static final double BETA = 0.1d;
    static final double GAMMA = 0.1d;
    static final int SEASONAL_PERIOD = 7;
    static final double INITIAL_CONFIDENCE = 0.8d;
    static final double CONFIDENCE_DECAY = 0.3d;

    @Override
    public ForecastModelType type() {
        return ForecastModelType.EXPONENTIAL;
    }

    @Override
    public ModelResult fit(PreparedSeries history, int horizon) {
        double[] values = history.values();
        if (values.length == 0) {
            throw new ModelFitException(type(), "history is empty");
        }
        double level = SeriesStatistics.mean(Arrays.copyOfRange(values, 0, Math.min(SEASONAL_PERIOD, values.length)));
        double trend = 0d;
        double[] seasonals = new double[SEASONAL_PERIOD];
        Arrays.fill(seasonals, 1d);
        if (level != 0d) {
            for (int i = 0; i < SEASONAL_PERIOD && i < values.length; i++) {
                seasonals[i] = values[i] / level;
            }
        }

        for (int i = 1; i < values.length; i++) {
            int phase = i % SEASONAL_PERIOD;
            double deseasonalized = seasonals[phase] == 0d ? values[i] : values[i] / seasonals[phase];
            double newLevel = ALPHA * deseasonalized + (1 - ALPHA) * (level + trend);
            double newTrend = BETA * (newLevel - level) + (1 - BETA) * trend;
            if (newLevel != 0d) {
                seasonals[phase] = GAMMA * (values[i] / newLevel) + (1 - GAMMA) * seasonals[phase];
            }
            level = newLevel;
            trend = newTrend;
        }
        if (!Double.isFinite(level) || !Double.isFinite(trend)) {
            throw new ModelFitException(type(), "smoothing diverged");
        }

        List<ForecastPoint> predictions = new ArrayList<>(horizon);
        for (int step = 0; step < horizon; step++) {
            int phase = (values.length + step) % SEASONAL_PERIOD;
            double value = Math.max(0d, (level + (step + 1) * trend) * seasonals[phase]);
            double confidence = INITIAL_CONFIDENCE - ((double) step / horizon) * CONFIDENCE_DECAY;
            predictions.add(new ForecastPoint(ForecastModel.futureDate(history, step), value, confidence));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("level", level);
        parameters.put("trend", trend);
        parameters.put("seasonalComponents", Arrays.stream(seasonals).boxed().toList());
        parameters.put("seasonalPeriod", SEASONAL_PERIOD);
        return new ModelResult(type(), predictions, Reliability.MEDIUM, null, parameters);
    }
}
