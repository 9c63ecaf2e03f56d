package com.costwatch.analysis.monitoring;

import com.costwatch.analysis.anomaly.EnsembleAnomaly;
import java.time.Instant;
import java.util.List;

public record MonitoringRun(
        Instant windowStart,
        Instant windowEnd,
        int recordCount,
        boolean skipped,
        List<EnsembleAnomaly> anomalies,
        int alertsPublished
) {
    static MonitoringRun skipped(Instant windowStart, Instant windowEnd, int recordCount) {
        return new MonitoringRun(windowStart, windowEnd, recordCount, true, List.of(), 0);
    }
}
