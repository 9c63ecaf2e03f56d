package com.costwatch.analysis.forecast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InsightGeneratorTest {

    private final InsightGenerator generator = new InsightGenerator();

    private static EnsembleForecast forecast(double total, double averageDaily, double volatility, double seasonality) {
        return new EnsembleForecast(List.of(), total, averageDaily, TrendDirection.INCREASING,
                volatility, seasonality, 0.8, Map.of(), List.of());
    }

    @Test
    void steadyForecastProducesNoInsights() {
        ForecastInsights insights = generator.generate(100, forecast(3000, 100, 0.1, 0.1), 30);

        assertThat(insights.significantChanges()).isEmpty();
        assertThat(insights.alerts()).isEmpty();
        assertThat(insights.recommendations()).isEmpty();
    }

    @Test
    void largeIncreaseRaisesTrendChangeAndBudgetRisk() {
        ForecastInsights insights = generator.generate(100, forecast(4500, 150, 0.1, 0.1), 30);

        assertThat(insights.significantChanges()).singleElement().satisfies(change -> {
            assertThat(change.type()).isEqualTo("trend_change");
            assertThat(change.impact()).isEqualTo("high");
            assertThat(change.value()).isEqualTo(50d);
            assertThat(change.description()).isEqualTo("Predicted increase of 50.0% in average daily costs");
        });
        assertThat(insights.alerts()).extracting(ForecastInsights.Alert::type).containsExactly("budget_risk");
    }

    @Test
    void moderateDecreaseIsMediumImpact() {
        ForecastInsights insights = generator.generate(100, forecast(2400, 80, 0.1, 0.1), 30);

        assertThat(insights.significantChanges()).singleElement()
                .extracting(ForecastInsights.SignificantChange::impact)
                .isEqualTo("medium");
    }

    @Test
    void volatilityAndSeasonalityThresholds() {
        ForecastInsights insights = generator.generate(100, forecast(3000, 100, 0.31, 0.41), 30);

        assertThat(insights.alerts()).extracting(ForecastInsights.Alert::type).containsExactly("high_volatility");
        assertThat(insights.recommendations()).extracting(ForecastInsights.Recommendation::type)
                .containsExactly("seasonal_optimization");
    }

    @Test
    void zeroHistoryMeansNoChange() {
        assertThat(InsightGenerator.changePercent(0, 50)).isZero();
    }
}
