package com.costwatch.analysis.anomaly;

import static org.assertj.core.api.Assertions.assertThat;

import com.costwatch.analysis.config.CostwatchProperties;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnomalyReportGeneratorTest {

    private final AnomalyReportGenerator generator = new AnomalyReportGenerator(CostwatchProperties.defaults());

    private static EnsembleAnomaly anomaly(String label, LocalDate date, double value, double confidence, Severity severity) {
        String key = EnsembleAnomaly.uniqueKey(date, label);
        return new EnsembleAnomaly(
                "anomaly_" + key + "_0", key, 0,
                date.atStartOfDay(ZoneOffset.UTC).toInstant(), date, label, value,
                List.of(AnomalyAlgorithm.ZSCORE), 1, confidence, severity,
                severity == Severity.CRITICAL, false, Map.of(), null, null);
    }

    @Test
    void overlappingRunsKeepOneEntryPerDateAndService() {
        LocalDate day = LocalDate.of(2024, 5, 10);
        List<EnsembleAnomaly> morning = List.of(anomaly("EC2", day, 900, 0.6, Severity.HIGH));
        List<EnsembleAnomaly> evening = List.of(
                anomaly("EC2", day, 900, 0.7, Severity.HIGH),
                anomaly("S3", day, 40, 0.3, Severity.MEDIUM));

        AnomalyReport report = generator.generate(List.of(morning, evening), null);

        assertThat(report.totalAnomalies()).isEqualTo(2);
        assertThat(report.anomalies()).extracting(EnsembleAnomaly::uniqueKey)
                .containsExactly("2024-05-10_EC2", "2024-05-10_S3");
        assertThat(report.anomalies().get(0).confidence()).isEqualTo(0.6);
    }

    @Test
    void summarisesSeverityServicesAndRange() {
        LocalDate start = LocalDate.of(2024, 5, 1);
        List<EnsembleAnomaly> anomalies = List.of(
                anomaly("EC2", start, 500, 0.9, Severity.CRITICAL),
                anomaly("EC2", start.plusDays(1), 400, 0.8, Severity.HIGH),
                anomaly("RDS", start.plusDays(2), 90, 0.5, Severity.MEDIUM),
                anomaly("S3", start.plusDays(3), 10, 0.2, Severity.LOW));

        AnomalyReport report = generator.generate(anomalies);

        assertThat(report.severityBreakdown()).isEqualTo(new AnomalyReport.SeverityBreakdown(2, 1, 1));
        assertThat(report.topServices().get(0)).isEqualTo(new AnomalyReport.ServiceCount("EC2", 2));
        assertThat(report.dateRange()).isEqualTo(new AnomalyReport.DateRange(start, start.plusDays(3)));
        assertThat(report.recommendations()).extracting(AnomalyReport.Recommendation::type)
                .containsExactly("immediate_action", "review", "optimization");
        assertThat(report.recommendations().get(0).description()).contains("2 high-severity");
        assertThat(report.recommendations().get(2).action()).contains("EC2");
    }

    @Test
    void capsAnomaliesAndTopServices() {
        List<EnsembleAnomaly> anomalies = new ArrayList<>();
        LocalDate start = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < 70; i++) {
            anomalies.add(anomaly("svc-" + (i % 7), start.plusDays(i), 100 + i, i / 100d, Severity.MEDIUM));
        }

        AnomalyReport report = generator.generate(anomalies);

        assertThat(report.totalAnomalies()).isEqualTo(70);
        assertThat(report.anomalies()).hasSize(50);
        assertThat(report.anomalies().get(0).confidence()).isEqualTo(0.69);
        assertThat(report.topServices()).hasSize(5);
    }

    @Test
    void emptyInputKeepsRequestedRange() {
        AnomalyReport.DateRange range = new AnomalyReport.DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        AnomalyReport report = generator.generate(List.of(List.of()), range);

        assertThat(report.totalAnomalies()).isZero();
        assertThat(report.dateRange()).isEqualTo(range);
        assertThat(report.recommendations()).isEmpty();
    }
}
