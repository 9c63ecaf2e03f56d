package com.costwatch.analysis.series;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SeriesStatisticsTest {

    @Test
    void populationVarianceAndStandardDeviation() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(SeriesStatistics.mean(values)).isEqualTo(5d);
        assertThat(SeriesStatistics.variance(values)).isEqualTo(4d);
        assertThat(SeriesStatistics.standardDeviation(values)).isEqualTo(2d);
    }

    @Test
    void quantileUsesNearestRankWithEvenSampleAveraging() {
        double[] sorted = {1, 2, 3, 4};

        assertThat(SeriesStatistics.quantileSorted(sorted, 0.5)).isEqualTo(2.5d);
        assertThat(SeriesStatistics.quantileSorted(sorted, 0.25)).isEqualTo(1.5d);
        assertThat(SeriesStatistics.quantileSorted(new double[] {1, 2, 3, 4, 5}, 0.25)).isEqualTo(2d);
        assertThat(SeriesStatistics.quantileSorted(sorted, 1d)).isEqualTo(4d);
    }

    @Test
    void degenerateInputsResolveToNeutralValues() {
        assertThat(SeriesStatistics.mean(new double[0])).isZero();
        assertThat(SeriesStatistics.coefficientOfVariation(new double[] {0, 0, 0})).isZero();
        assertThat(SeriesStatistics.rSquared(new double[] {5, 5, 5}, new double[] {5, 5, 5})).isEqualTo(1d);
        assertThat(SeriesStatistics.rSquared(new double[] {5, 5, 5}, new double[] {4, 5, 6})).isZero();
    }

    @Test
    void rSquaredIsOneForExactFit() {
        double[] actual = {1, 3, 5, 7};

        assertThat(SeriesStatistics.rSquared(actual, actual)).isCloseTo(1d, within(1e-12));
    }
}
