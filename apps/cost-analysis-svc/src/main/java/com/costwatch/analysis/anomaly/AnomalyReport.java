package com.costwatch.analysis.anomaly;

import java.time.LocalDate;
import java.util.List;

public record AnomalyReport(
        int totalAnomalies,
        SeverityBreakdown severityBreakdown,
        List<ServiceCount> topServices,
        DateRange dateRange,
        List<Recommendation> recommendations,
        List<EnsembleAnomaly> anomalies
) {
    public static AnomalyReport empty(DateRange requestedRange) {
        return new AnomalyReport(0, new SeverityBreakdown(0, 0, 0), List.of(), requestedRange, List.of(), List.of());
    }

    /**
     * {@code high} includes critical anomalies.
     */
    public record SeverityBreakdown(int high, int medium, int low) {
    }

    public record ServiceCount(String service, int count) {
    }

    public record DateRange(LocalDate start, LocalDate end) {
        public DateRange {
            if (start != null && end != null && end.isBefore(start)) {
                throw new IllegalArgumentException("dateRange end must not be before start");
            }
        }
    }

    public record Recommendation(String type, String priority, String title, String description, String action) {
    }
}
