package com.costwatch.analysis.forecast;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores a model between 0.4 and 0.95 so the ensemble can weight it.
 */
@Component
public class ModelAccuracyEstimator {

    private static final Logger log = LoggerFactory.getLogger(ModelAccuracyEstimator.class);

    static final double MIN_ACCURACY = 0.4d;
    static final double MAX_ACCURACY = 0.95d;
    static final int FULL_CREDIT_LENGTH = 30;
    static final double HOLDOUT_SHARE = 0.2d;

    public double accuracy(PreparedSeries history, ForecastModel model, AccuracyStrategy strategy) {
        if (strategy == AccuracyStrategy.BACKTEST) {
            return backtest(history, model);
        }
        return estimate(history, model.type());
    }

    /**
     * {@code (base - volatility * penalty) * min(1, n / 30)}, clamped.
     */
    public double estimate(PreparedSeries history, ForecastModelType type) {
        double volatility = SeriesStatistics.coefficientOfVariation(history.values());
        double raw = type.baseAccuracy() - volatility * type.volatilityPenalty();
        double lengthFactor = Math.min(1d, (double) history.size() / FULL_CREDIT_LENGTH);
        return clamp(raw * lengthFactor);
    }

    /**
     * Refits on everything but the last {@code max(1, n * 0.2)} points and scores {@code 1 - MAPE} on the
     * held-out tail. Falls back to {@link #estimate} when the refit fails or every held-out actual is zero.
     */
    public double backtest(PreparedSeries history, ForecastModel model) {
        int holdout = Math.max(1, (int) Math.floor(history.size() * HOLDOUT_SHARE));
        int trainingSize = history.size() - holdout;
        if (trainingSize < 2) {
            return estimate(history, model.type());
        }
        List<ForecastPoint> predicted;
        try {
            predicted = model.fit(history.head(trainingSize), holdout).predictions();
        } catch (ModelFitException ex) {
            log.debug("Backtest refit failed for {}: {}", model.type().id(), ex.getMessage());
            return estimate(history, model.type());
        }

        double errorSum = 0d;
        int scored = 0;
        for (int i = 0; i < holdout && i < predicted.size(); i++) {
            double actual = history.get(trainingSize + i).value();
            if (actual == 0d) {
                continue;
            }
            errorSum += Math.abs((actual - predicted.get(i).value()) / actual);
            scored++;
        }
        if (scored == 0) {
            return estimate(history, model.type());
        }
        double accuracy = clamp(1d - errorSum / scored);
        log.debug("Backtest accuracy for {} over {} held-out points: {}", model.type().id(), scored, accuracy);
        return accuracy;
    }

    private static double clamp(double accuracy) {
        return Math.max(MIN_ACCURACY, Math.min(MAX_ACCURACY, accuracy));
    }
}
