package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.config.CostwatchProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnomalyReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportGenerator.class);

    private final int reportLimit;
    private final int topServiceLimit;

    public AnomalyReportGenerator(CostwatchProperties properties) {
        this.reportLimit = properties.anomaly().reportLimit();
        this.topServiceLimit = properties.anomaly().topServices();
    }

    /**
     * Builds a report from one or more detection runs. Runs are deduplicated by date and service with
     * the earliest run winning, then ordered by confidence.
     *
     * @param requestedRange range to report; when {@code null} the range spanned by the anomalies is used
     */
    public AnomalyReport generate(List<List<EnsembleAnomaly>> runs, AnomalyReport.DateRange requestedRange) {
        List<EnsembleAnomaly> merged = new ArrayList<>();
        runs.forEach(merged::addAll);
        if (merged.isEmpty()) {
            return AnomalyReport.empty(requestedRange);
        }
        List<EnsembleAnomaly> unique = AnomalyEnsemble.deduplicate(merged).stream()
                .sorted(Comparator.comparingDouble(EnsembleAnomaly::confidence).reversed())
                .toList();
        log.info("Report deduplication: {} -> {} unique anomalies", merged.size(), unique.size());

        AnomalyReport.DateRange dateRange = requestedRange != null ? requestedRange : spannedRange(unique);
        return new AnomalyReport(
                unique.size(),
                severityBreakdown(unique),
                topServices(unique),
                dateRange,
                recommendations(unique),
                unique.stream().limit(reportLimit).toList()
        );
    }

    public AnomalyReport generate(List<EnsembleAnomaly> anomalies) {
        return generate(List.of(anomalies), null);
    }

    private AnomalyReport.SeverityBreakdown severityBreakdown(List<EnsembleAnomaly> anomalies) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (EnsembleAnomaly anomaly : anomalies) {
            switch (anomaly.severity()) {
                case CRITICAL, HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new AnomalyReport.SeverityBreakdown(high, medium, low);
    }

    private List<AnomalyReport.ServiceCount> topServices(List<EnsembleAnomaly> anomalies) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        anomalies.forEach(anomaly -> counts.merge(anomaly.label(), 1, Integer::sum));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(topServiceLimit)
                .map(entry -> new AnomalyReport.ServiceCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static AnomalyReport.DateRange spannedRange(List<EnsembleAnomaly> anomalies) {
        var start = anomalies.stream().map(EnsembleAnomaly::date).min(Comparator.naturalOrder()).orElse(null);
        var end = anomalies.stream().map(EnsembleAnomaly::date).max(Comparator.naturalOrder()).orElse(null);
        return new AnomalyReport.DateRange(start, end);
    }

    private static List<AnomalyReport.Recommendation> recommendations(List<EnsembleAnomaly> anomalies) {
        List<AnomalyReport.Recommendation> recommendations = new ArrayList<>();
        long highCount = anomalies.stream()
                .filter(anomaly -> anomaly.severity() == Severity.HIGH || anomaly.severity() == Severity.CRITICAL)
                .count();
        long mediumCount = anomalies.stream().filter(anomaly -> anomaly.severity() == Severity.MEDIUM).count();

        if (highCount > 0) {
            recommendations.add(new AnomalyReport.Recommendation(
                    "immediate_action",
                    "high",
                    "Immediate Cost Investigation Required",
                    "Found " + highCount + " high-severity cost anomalies that require immediate investigation.",
                    "Review the identified high-cost anomalies and determine if they represent unauthorized usage or configuration issues."
            ));
        }
        if (mediumCount > 0) {
            recommendations.add(new AnomalyReport.Recommendation(
                    "review",
                    "medium",
                    "Cost Pattern Review",
                    "Found " + mediumCount + " medium-severity cost anomalies worth reviewing.",
                    "Analyze the medium-severity anomalies to identify potential cost optimization opportunities."
            ));
        }

        Map<String, Double> costByService = new LinkedHashMap<>();
        anomalies.forEach(anomaly -> costByService.merge(anomaly.label(), anomaly.value(), Double::sum));
        String costliest = null;
        double costliestTotal = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : costByService.entrySet()) {
            if (entry.getValue() > costliestTotal) {
                costliest = entry.getKey();
                costliestTotal = entry.getValue();
            }
        }
        if (costliest != null) {
            recommendations.add(new AnomalyReport.Recommendation(
                    "optimization",
                    "medium",
                    "Service Cost Optimization",
                    "The service \"" + costliest + "\" has shown significant cost anomalies.",
                    "Review usage patterns for " + costliest + " and consider rightsizing or optimizing resources."
            ));
        }
        return recommendations;
    }
}
