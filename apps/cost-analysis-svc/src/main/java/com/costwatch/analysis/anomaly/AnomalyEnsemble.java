package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.PreparedPoint;
import com.costwatch.analysis.series.PreparedSeries;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges per-algorithm candidates that point at the same series index. A single algorithm is enough
 * for a point to be reported; agreement only raises confidence and severity.
 */
@Component
public class AnomalyEnsemble {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEnsemble.class);

    private static final double CONFIDENCE_WEIGHT = 0.7d;
    private static final double AGREEMENT_WEIGHT = 0.3d;
    private static final int ALGORITHM_COUNT = AnomalyAlgorithm.values().length;

    /**
     * @param candidates candidates in algorithm order; grouping keeps first-seen index order so the
     *                   result is deterministic for identical input
     */
    public List<EnsembleAnomaly> combine(List<CandidateAnomaly> candidates, PreparedSeries series, boolean realTime) {
        Map<Integer, List<CandidateAnomaly>> byIndex = new LinkedHashMap<>();
        for (CandidateAnomaly candidate : candidates) {
            byIndex.computeIfAbsent(candidate.seriesIndex(), key -> new ArrayList<>()).add(candidate);
        }

        List<EnsembleAnomaly> combined = new ArrayList<>(byIndex.size());
        byIndex.forEach((index, group) -> combined.add(merge(series.get(index), group, realTime)));

        List<EnsembleAnomaly> deduplicated = deduplicate(combined);
        log.debug("Deduplication: {} -> {} anomalies", combined.size(), deduplicated.size());
        return deduplicated.stream()
                .sorted(Comparator.comparingDouble(EnsembleAnomaly::confidence).reversed())
                .toList();
    }

    static double ensembleConfidence(double averageConfidence, int algorithmCount) {
        return averageConfidence * CONFIDENCE_WEIGHT + algorithmCount * AGREEMENT_WEIGHT / ALGORITHM_COUNT;
    }

    static Severity ensembleSeverity(List<CandidateAnomaly> group) {
        int algorithmCount = group.size();
        if (group.stream().anyMatch(candidate -> candidate.severity() == Severity.CRITICAL)) {
            return Severity.CRITICAL;
        }
        if (group.stream().anyMatch(candidate -> candidate.severity() == Severity.HIGH) || algorithmCount >= 3) {
            return Severity.HIGH;
        }
        if (algorithmCount >= 2) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    /**
     * Keeps the first anomaly seen for every {@code uniqueKey}.
     */
    public static List<EnsembleAnomaly> deduplicate(List<EnsembleAnomaly> anomalies) {
        Set<String> seen = new HashSet<>();
        List<EnsembleAnomaly> unique = new ArrayList<>(anomalies.size());
        for (EnsembleAnomaly anomaly : anomalies) {
            if (seen.add(anomaly.uniqueKey())) {
                unique.add(anomaly);
            }
        }
        return unique;
    }

    private EnsembleAnomaly merge(PreparedPoint point, List<CandidateAnomaly> group, boolean realTime) {
        int algorithmCount = group.size();
        double averageConfidence = group.stream().mapToDouble(CandidateAnomaly::confidence).average().orElse(0d);
        Severity severity = ensembleSeverity(group);
        boolean needsImmediateAlert = severity == Severity.CRITICAL
                || (severity == Severity.HIGH && algorithmCount >= 3);

        Map<AnomalyAlgorithm, Map<String, Double>> stats = new EnumMap<>(AnomalyAlgorithm.class);
        group.forEach(candidate -> stats.putIfAbsent(candidate.algorithm(), candidate.stats()));

        String label = point.label();
        String uniqueKey = EnsembleAnomaly.uniqueKey(point.date(), label);
        return new EnsembleAnomaly(
                "anomaly_" + uniqueKey + "_" + point.index(),
                uniqueKey,
                point.index(),
                point.timestamp(),
                point.date(),
                label,
                point.value(),
                group.stream().map(CandidateAnomaly::algorithm).toList(),
                algorithmCount,
                ensembleConfidence(averageConfidence, algorithmCount),
                severity,
                needsImmediateAlert,
                realTime,
                stats,
                point.source().organization(),
                point.source().region()
        );
    }
}
