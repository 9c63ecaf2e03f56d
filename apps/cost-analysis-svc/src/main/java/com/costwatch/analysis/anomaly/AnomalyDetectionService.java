package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.model.InsufficientDataException;
import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.TimeSeriesPreparer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final TimeSeriesPreparer preparer;
    private final Map<AnomalyAlgorithm, AnomalyDetector> detectors;
    private final AnomalyEnsemble ensemble;

    public AnomalyDetectionService(TimeSeriesPreparer preparer, List<AnomalyDetector> detectors, AnomalyEnsemble ensemble) {
        this.preparer = preparer;
        this.detectors = new EnumMap<>(AnomalyAlgorithm.class);
        for (AnomalyDetector detector : detectors) {
            this.detectors.put(detector.algorithm(), detector);
        }
        this.ensemble = ensemble;
    }

    /**
     * Runs the selected algorithms over one series and merges their findings. Returns an empty list
     * when the series is shorter than {@code options.minDataPoints()}.
     */
    public List<EnsembleAnomaly> detectAnomalies(List<CostRecord> records, AnomalyDetectionOptions options) {
        PreparedSeries series;
        try {
            series = preparer.prepare(records, options.minDataPoints());
        } catch (InsufficientDataException ex) {
            log.info("Skipping anomaly detection: {}", ex.getMessage());
            return List.of();
        }

        List<CandidateAnomaly> candidates = new ArrayList<>();
        for (AnomalyAlgorithm algorithm : options.algorithms()) {
            AnomalyDetector detector = detectors.get(algorithm);
            if (detector == null) {
                log.warn("No detector registered for algorithm {}", algorithm.id());
                continue;
            }
            try {
                candidates.addAll(detector.detect(series, options.threshold()));
            } catch (RuntimeException ex) {
                log.warn("Anomaly algorithm {} failed; continuing without it", algorithm.id(), ex);
            }
        }

        List<EnsembleAnomaly> anomalies = ensemble.combine(candidates, series, options.realTime());
        log.info("Detected {} anomalies in {} data points using {} algorithms",
                anomalies.size(), series.size(), options.algorithms().size());
        return anomalies;
    }

    /**
     * Splits records by service label and detects anomalies per service. Services with fewer records
     * than {@code options.minDataPoints()} are skipped.
     */
    public List<EnsembleAnomaly> detectServiceAnomalies(List<CostRecord> records, AnomalyDetectionOptions options) {
        if (records == null || records.isEmpty()) {
            log.info("No service data provided for anomaly detection");
            return List.of();
        }
        Map<String, List<CostRecord>> byService = new LinkedHashMap<>();
        int skipped = 0;
        for (CostRecord record : records) {
            if (record == null || record.timestamp() == null || record.amount() == null) {
                skipped++;
                continue;
            }
            byService.computeIfAbsent(record.labelOrUnknown(), key -> new ArrayList<>()).add(record);
        }
        if (skipped > 0) {
            log.debug("Ignored {} records without timestamp or amount", skipped);
        }

        List<EnsembleAnomaly> anomalies = new ArrayList<>();
        byService.forEach((service, serviceRecords) -> {
            if (serviceRecords.size() < options.minDataPoints()) {
                log.debug("Skipping {}: insufficient data ({} < {})", service, serviceRecords.size(), options.minDataPoints());
                return;
            }
            List<EnsembleAnomaly> found = detectAnomalies(serviceRecords, options);
            if (!found.isEmpty()) {
                log.info("Found {} anomalies in {}", found.size(), service);
            }
            anomalies.addAll(found);
        });
        return anomalies.stream()
                .sorted(Comparator.comparingDouble(EnsembleAnomaly::confidence).reversed())
                .toList();
    }
}
