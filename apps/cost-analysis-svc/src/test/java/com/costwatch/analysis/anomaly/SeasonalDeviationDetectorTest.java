package com.costwatch.analysis.anomaly;

import static com.costwatch.analysis.CostRecordFixtures.daily;
import static com.costwatch.analysis.CostRecordFixtures.steady;
import static org.assertj.core.api.Assertions.assertThat;

import com.costwatch.analysis.series.TimeSeriesPreparer;
import org.junit.jupiter.api.Test;

class SeasonalDeviationDetectorTest {

    private final SeasonalDeviationDetector detector = new SeasonalDeviationDetector();
    private final TimeSeriesPreparer preparer = new TimeSeriesPreparer();

    @Test
    void returnsNothingBelowThreeWeeks() {
        double[] values = steady(20, 100);
        values[10] = 1000;

        assertThat(detector.detect(preparer.prepare(daily("EC2", values)), 2.5)).isEmpty();
    }

    @Test
    void flagsDayFarFromItsWeekdayProfile() {
        double[] values = steady(28, 100);
        values[14] = 400;

        assertThat(detector.detect(preparer.prepare(daily("EC2", values)), 2.5))
                .extracting(CandidateAnomaly::seriesIndex)
                .containsExactly(14);
    }
}
