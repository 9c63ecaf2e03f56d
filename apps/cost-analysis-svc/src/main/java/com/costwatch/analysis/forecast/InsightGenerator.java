package com.costwatch.analysis.forecast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class InsightGenerator {

    static final double TREND_CHANGE_PERCENT = 15d;
    static final double HIGH_IMPACT_PERCENT = 30d;
    static final double VOLATILITY_LIMIT = 0.3d;
    static final double SEASONALITY_LIMIT = 0.4d;
    static final double BUDGET_TOLERANCE = 1.2d;

    /**
     * @param historicalAverage mean daily cost of the history the forecast was built from
     */
    public ForecastInsights generate(double historicalAverage, EnsembleForecast forecast, int horizon) {
        List<ForecastInsights.SignificantChange> changes = new ArrayList<>();
        List<ForecastInsights.Recommendation> recommendations = new ArrayList<>();
        List<ForecastInsights.Alert> alerts = new ArrayList<>();

        double changePercent = changePercent(historicalAverage, forecast.averageDaily());
        if (Math.abs(changePercent) > TREND_CHANGE_PERCENT) {
            changes.add(new ForecastInsights.SignificantChange(
                    "trend_change",
                    String.format(Locale.ROOT, "Predicted %s of %.1f%% in average daily costs",
                            changePercent > 0 ? "increase" : "decrease", Math.abs(changePercent)),
                    Math.abs(changePercent) > HIGH_IMPACT_PERCENT ? "high" : "medium",
                    changePercent
            ));
        }

        if (forecast.volatility() > VOLATILITY_LIMIT) {
            alerts.add(new ForecastInsights.Alert(
                    "high_volatility",
                    "High cost volatility predicted - consider implementing cost controls",
                    "warning"
            ));
        }

        if (forecast.seasonality() > SEASONALITY_LIMIT) {
            recommendations.add(new ForecastInsights.Recommendation(
                    "seasonal_optimization",
                    "Strong seasonal patterns detected - optimize resources based on predicted low-cost periods",
                    "Consider scheduled scaling or reserved instances"
            ));
        }

        if (forecast.total() > historicalAverage * horizon * BUDGET_TOLERANCE) {
            alerts.add(new ForecastInsights.Alert(
                    "budget_risk",
                    String.format(Locale.ROOT, "Predicted %d-day total of $%.2f exceeds expected budget", horizon, forecast.total()),
                    "high"
            ));
        }
        return new ForecastInsights(changes, recommendations, alerts);
    }

    // a zero baseline means no measurable change rather than an infinite one
    static double changePercent(double historicalAverage, double predictedAverage) {
        if (historicalAverage == 0d) {
            return 0d;
        }
        return (predictedAverage - historicalAverage) / historicalAverage * 100d;
    }
}
