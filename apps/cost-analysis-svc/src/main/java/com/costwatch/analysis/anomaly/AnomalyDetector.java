package com.costwatch.analysis.anomaly;

import com.costwatch.analysis.series.PreparedSeries;
import java.util.List;

/**
 * One anomaly algorithm. Implementations are stateless and return an empty list when the series is
 * too short for them or statistically degenerate.
 */
public interface AnomalyDetector {

    AnomalyAlgorithm algorithm();

    List<CandidateAnomaly> detect(PreparedSeries series, double threshold);
}
