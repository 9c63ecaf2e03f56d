package com.costwatch.analysis.monitoring;

import com.costwatch.analysis.anomaly.AnomalyDetectionOptions;
import com.costwatch.analysis.anomaly.AnomalyDetectionService;
import com.costwatch.analysis.anomaly.EnsembleAnomaly;
import com.costwatch.analysis.config.CostwatchProperties;
import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.web.RequestContextHolder;
import com.costwatch.analysis.web.TraceIdFilter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-runs per-service detection over the recent window on a fixed cadence and publishes anomalies that
 * need an immediate alert. Overlapping windows report the same anomaly again; consumers dedupe by
 * {@link EnsembleAnomaly#uniqueKey()}.
 */
@Component
public class AnomalyMonitoringJob {

    private static final Logger log = LoggerFactory.getLogger(AnomalyMonitoringJob.class);

    private final AnomalyDetectionService detectionService;
    private final CostRecordSource recordSource;
    private final AlertPublisher alertPublisher;
    private final CostwatchProperties.Monitoring settings;
    private final AnomalyDetectionOptions options;
    private final Clock clock;

    public AnomalyMonitoringJob(
            AnomalyDetectionService detectionService,
            CostRecordSource recordSource,
            AlertPublisher alertPublisher,
            CostwatchProperties properties,
            Clock clock
    ) {
        this.detectionService = detectionService;
        this.recordSource = recordSource;
        this.alertPublisher = alertPublisher;
        this.settings = properties.monitoring();
        this.options = properties.anomaly().toOptions()
                .withRealTime(true)
                .withMinDataPoints(settings.minDataPoints());
        this.clock = clock;
    }

    @Scheduled(cron = "${costwatch.monitoring.cron:0 */15 * * * *}")
    public void runOnSchedule() {
        if (!settings.enabledFlag()) {
            log.debug("Anomaly monitoring disabled; skipping scheduled run");
            return;
        }
        String traceId = "monitor-" + UUID.randomUUID();
        RequestContextHolder.set(RequestContextHolder.RequestContext.builder()
                .traceId(traceId)
                .origin(RequestContextHolder.RequestContext.Origin.SCHEDULED)
                .build());
        MDC.put(TraceIdFilter.MDC_KEY, traceId);
        try {
            run();
        } catch (RuntimeException ex) {
            log.error("Scheduled anomaly monitoring run failed", ex);
        } finally {
            MDC.remove(TraceIdFilter.MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    public MonitoringRun run() {
        Instant windowEnd = clock.instant();
        Duration lookback = Duration.ofDays(settings.lookbackDays());
        Instant windowStart = windowEnd.minus(lookback);
        // keep one extra lookback of history behind the window
        int evicted = recordSource.evictBefore(windowStart.minus(lookback));
        if (evicted > 0) {
            log.debug("Evicted {} buffered records older than {}", evicted, windowStart.minus(lookback));
        }
        List<CostRecord> records = recordSource.recordsBetween(windowStart, windowEnd);
        if (records.size() < settings.minRecords()) {
            log.debug("Monitoring window has {} records (< {}); skipping", records.size(), settings.minRecords());
            return MonitoringRun.skipped(windowStart, windowEnd, records.size());
        }

        List<EnsembleAnomaly> anomalies = detectionService.detectServiceAnomalies(records, options);
        List<EnsembleAnomaly> urgent = anomalies.stream().filter(EnsembleAnomaly::needsImmediateAlert).toList();
        int published = 0;
        if (!urgent.isEmpty()) {
            try {
                alertPublisher.publishAnomalies(urgent);
                published = urgent.size();
            } catch (RuntimeException ex) {
                log.warn("Failed to publish {} anomaly alerts", urgent.size(), ex);
            }
        }
        log.info("Monitoring run over {} records: {} anomalies, {} alerts published",
                records.size(), anomalies.size(), published);
        return new MonitoringRun(windowStart, windowEnd, records.size(), false, anomalies, published);
    }
}
