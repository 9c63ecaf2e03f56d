package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.PreparedSeries;
import com.costwatch.analysis.series.SeriesStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tukey fences over the whole series. The threshold argument is not used; the fences are fixed at
 * 1.5 IQR.
 */
@Component
public class IqrDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IqrDetector.class);

    private static final double IQR_MULTIPLIER = 1.5d;
    private static final double MAX_CONFIDENCE_RATIO = 3d;

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.IQR;
    }

    @Override
    public List<CandidateAnomaly> detect(PreparedSeries series, double threshold) {
        if (series.isEmpty()) {
            return List.of();
        }
        double[] values = series.values();
        Bounds bounds = bounds(values);
        double maxDeviation = Math.max(bounds.upper() - bounds.q3(), bounds.q1() - bounds.lower());

        List<CandidateAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value >= bounds.lower() && value <= bounds.upper()) {
                continue;
            }
            double deviation = value > bounds.upper() ? value - bounds.upper() : bounds.lower() - value;
            // zero IQR: any point outside the (collapsed) fences is maximally unusual
            double ratio = maxDeviation > 0d ? deviation / maxDeviation : Double.POSITIVE_INFINITY;
            anomalies.add(new CandidateAnomaly(
                    i,
                    value,
                    AnomalyAlgorithm.IQR,
                    Math.min(ratio, MAX_CONFIDENCE_RATIO) / MAX_CONFIDENCE_RATIO,
                    severityFor(ratio),
                    Map.of(
                            "q1", bounds.q1(),
                            "q3", bounds.q3(),
                            "iqr", bounds.q3() - bounds.q1(),
                            "lowerBound", bounds.lower(),
                            "upperBound", bounds.upper(),
                            "deviation", deviation
                    )
            ));
        }
        log.debug("IQR detected {} anomalies (bounds {} .. {})", anomalies.size(), bounds.lower(), bounds.upper());
        return anomalies;
    }

    public static Bounds bounds(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double q1 = SeriesStatistics.quantileSorted(sorted, 0.25);
        double q3 = SeriesStatistics.quantileSorted(sorted, 0.75);
        double iqr = q3 - q1;
        return new Bounds(q1, q3, q1 - IQR_MULTIPLIER * iqr, q3 + IQR_MULTIPLIER * iqr);
    }

    private static Severity severityFor(double ratio) {
        if (ratio > 2d) {
            return Severity.CRITICAL;
        }
        if (ratio > 1d) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }

    public record Bounds(double q1, double q3, double lower, double upper) {
    }
}
