package com.costwatch.analysis.anomaly;

import static com.costwatch.analysis.CostRecordFixtures.daily;
import static com.costwatch.analysis.CostRecordFixtures.steady;
import static org.assertj.core.api.Assertions.assertThat;

import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.series.TimeSeriesPreparer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectionServiceTest {

    private final AnomalyDetectionService service = new AnomalyDetectionService(
            new TimeSeriesPreparer(),
            List.of(new ZScoreDetector(), new IqrDetector(), new RegressionResidualDetector(), new SeasonalDeviationDetector()),
            new AnomalyEnsemble());

    @Test
    void sixPointsAreBelowMinimumAndYieldNothing() {
        List<CostRecord> records = daily("EC2", 100, 105, 95, 102, 1000, 98);

        assertThat(service.detectAnomalies(records, AnomalyDetectionOptions.defaults())).isEmpty();
    }

    @Test
    void outlierInSevenPointsIsCriticalForZScoreAndIqr() {
        List<CostRecord> records = daily("EC2", 100, 105, 95, 102, 1000, 98, 101);

        List<EnsembleAnomaly> anomalies = service.detectAnomalies(records, AnomalyDetectionOptions.defaults());

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.value()).isEqualTo(1000d);
            assertThat(anomaly.algorithms()).contains(AnomalyAlgorithm.ZSCORE, AnomalyAlgorithm.IQR);
            assertThat(anomaly.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(anomaly.needsImmediateAlert()).isTrue();
            assertThat(anomaly.algorithmStats()).containsKeys(AnomalyAlgorithm.ZSCORE, AnomalyAlgorithm.IQR);
        });
    }

    @Test
    void rerunOnSameWindowIsIdentical() {
        double[] values = steady(40, 100);
        values[12] = 300;
        values[30] = 20;
        List<CostRecord> records = daily("RDS", values);

        List<EnsembleAnomaly> first = service.detectAnomalies(records, AnomalyDetectionOptions.defaults());
        List<EnsembleAnomaly> second = service.detectAnomalies(new ArrayList<>(records), AnomalyDetectionOptions.defaults());

        assertThat(first).isNotEmpty().isEqualTo(second);
    }

    @Test
    void honoursSelectedAlgorithms() {
        List<CostRecord> records = daily("EC2", 100, 105, 95, 102, 1000, 98, 101);
        AnomalyDetectionOptions iqrOnly = new AnomalyDetectionOptions(2.5, List.of(AnomalyAlgorithm.IQR), 7, false);

        assertThat(service.detectAnomalies(records, iqrOnly))
                .singleElement()
                .extracting(EnsembleAnomaly::algorithms)
                .isEqualTo(List.of(AnomalyAlgorithm.IQR));
    }

    @Test
    void perServiceDetectionSkipsShortServicesAndKeepsLabels() {
        List<CostRecord> records = new ArrayList<>(daily("EC2", 100, 105, 95, 102, 1000, 98, 101));
        records.addAll(daily("S3", 5, 6, 500));

        List<EnsembleAnomaly> anomalies = service.detectServiceAnomalies(records, AnomalyDetectionOptions.defaults());

        assertThat(anomalies).extracting(EnsembleAnomaly::label).containsOnly("EC2");
    }

    @Test
    void passesOrganizationAndRegionThrough() {
        List<CostRecord> records = daily("EC2", 100, 105, 95, 102, 1000, 98, 101).stream()
                .map(r -> new CostRecord(r.timestamp(), r.label(), r.amount(), "acme", "us-east-1"))
                .toList();

        EnsembleAnomaly anomaly = service.detectServiceAnomalies(records, AnomalyDetectionOptions.defaults()).get(0);

        assertThat(anomaly.organization()).isEqualTo("acme");
        assertThat(anomaly.region()).isEqualTo("us-east-1");
    }

    @Test
    void perServiceDetectionIgnoresMissingRecords() {
        List<CostRecord> records = new ArrayList<>();
        records.add(null);
        records.addAll(daily("EC2", 100, 105, 95, 102, 1000, 98, 101));
        records.add(new CostRecord(null, "EC2", BigDecimal.TEN, null, null));
        records.add(new CostRecord(Instant.parse("2024-02-01T00:00:00Z"), "EC2", null, null, null));

        List<EnsembleAnomaly> anomalies = service.detectServiceAnomalies(records, AnomalyDetectionOptions.defaults());

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.label()).isEqualTo("EC2");
            assertThat(anomaly.value()).isEqualTo(1000d);
        });
    }
}
