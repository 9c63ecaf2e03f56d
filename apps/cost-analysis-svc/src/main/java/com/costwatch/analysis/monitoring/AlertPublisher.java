package com.costwatch.analysis.monitoring;

import com.costwatch.analysis.anomaly.EnsembleAnomaly;
import com.costwatch.analysis.forecast.ForecastReport;
import java.util.List;

/**
 * Hands findings to a notification channel. Callers treat every call as fire-and-forget: a failure is
 * logged and never fails the analysis that produced the payload.
 */
public interface AlertPublisher {

    void publishAnomalies(List<EnsembleAnomaly> anomalies);

    void publishForecastChange(ForecastReport forecast);
}
