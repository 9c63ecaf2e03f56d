package com.costwatch.analysis.series;

import static org.assertj.core.api.Assertions.assertThat;

import com.costwatch.analysis.model.CostRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DailyCostAggregatorTest {

    private final DailyCostAggregator aggregator = new DailyCostAggregator();

    private final List<CostRecord> records = List.of(
            CostRecord.of(Instant.parse("2024-03-01T01:00:00Z"), "EC2", new BigDecimal("10.00")),
            CostRecord.of(Instant.parse("2024-03-01T13:00:00Z"), "S3", new BigDecimal("2.50")),
            CostRecord.of(Instant.parse("2024-03-01T20:00:00Z"), "EC2", new BigDecimal("5.00")),
            CostRecord.of(Instant.parse("2024-03-02T00:00:00Z"), "EC2", new BigDecimal("7.00"))
    );

    @Test
    void sumsEveryServicePerDayForTotal() {
        List<CostRecord> daily = aggregator.aggregate(records, DailyCostAggregator.TOTAL);

        assertThat(daily).extracting(CostRecord::amount)
                .containsExactly(new BigDecimal("17.50"), new BigDecimal("7.00"));
        assertThat(daily).extracting(CostRecord::label).containsOnly("Total");
    }

    @Test
    void filtersToRequestedService() {
        List<CostRecord> daily = aggregator.aggregate(records, "EC2");

        assertThat(daily).extracting(CostRecord::amount)
                .containsExactly(new BigDecimal("15.00"), new BigDecimal("7.00"));
        assertThat(daily.get(0).timestamp()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void unknownServiceYieldsEmptySeries() {
        assertThat(aggregator.aggregate(records, "Lambda")).isEmpty();
    }
}
