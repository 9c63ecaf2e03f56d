package com.costwatch.analysis.forecast;

import static com.costwatch.analysis.CostRecordFixtures.steady;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class HoltWintersModelTest {

    private final HoltWintersModel model = new HoltWintersModel();

    @Test
    void constantSeriesStaysConstant() {
        double[] values = new double[21];
        Arrays.fill(values, 40d);

        ModelResult result = model.fit(ForecastFixtures.series(values), 14);

        assertThat(result.predictions()).allSatisfy(point -> assertThat(point.value()).isCloseTo(40d, within(1e-9)));
        assertThat(result.reliability()).isEqualTo(Reliability.MEDIUM);
        assertThat(result.fitQuality()).isNull();
    }

    @Test
    void confidenceDecaysFromPointEight() {
        ModelResult result = model.fit(ForecastFixtures.series(steady(28, 100)), 10);

        assertThat(result.predictions().get(0).confidence()).isEqualTo(0.8);
        assertThat(result.predictions().get(9).confidence()).isCloseTo(0.8 - 0.9 * 0.3, within(1e-12));
        for (int i = 1; i < result.predictions().size(); i++) {
            assertThat(result.predictions().get(i).confidence())
                    .isLessThan(result.predictions().get(i - 1).confidence());
        }
    }

    @Test
    void zeroSeriesDoesNotDivideByZero() {
        ModelResult result = model.fit(ForecastFixtures.series(new double[14]), 7);

        assertThat(result.predictions()).allSatisfy(point -> assertThat(point.value()).isZero());
    }
}
