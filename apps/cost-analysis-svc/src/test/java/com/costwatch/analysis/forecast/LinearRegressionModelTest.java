package com.costwatch.analysis.forecast;

import static com.costwatch.analysis.CostRecordFixtures.linear;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class LinearRegressionModelTest {

    private final LinearRegressionModel model = new LinearRegressionModel();

    @Test
    void perfectLineHasUnitRSquaredAndExtendsTheLine() {
        ModelResult result = model.fit(ForecastFixtures.series(linear(30, 100, 5)), 10);

        assertThat(result.fitQuality()).isCloseTo(1d, within(1e-9));
        assertThat(result.reliability()).isEqualTo(Reliability.HIGH);
        assertThat(result.predictions()).hasSize(10);
        assertThat(result.predictions().get(0).value()).isCloseTo(250d, within(1e-6));
        assertThat(result.predictions().get(9).value()).isCloseTo(295d, within(1e-6));
        assertThat(result.predictions().get(0).date()).isEqualTo(LocalDate.of(2024, 1, 31));
    }

    @Test
    void decliningLineIsFlooredAtZero() {
        ModelResult result = model.fit(ForecastFixtures.series(linear(20, 100, -5)), 30);

        assertThat(result.predictions()).allSatisfy(point -> assertThat(point.value()).isGreaterThanOrEqualTo(0d));
        assertThat(result.predictions().get(29).value()).isZero();
        assertThat(result.parameters()).containsEntry("trend", "decreasing");
    }

    @Test
    void noisySeriesRatesLow() {
        double[] values = {100, 10, 90, 20, 80, 30, 70, 40, 60, 50, 100, 10, 90, 20};

        assertThat(model.fit(ForecastFixtures.series(values), 7).reliability()).isEqualTo(Reliability.LOW);
    }
}
