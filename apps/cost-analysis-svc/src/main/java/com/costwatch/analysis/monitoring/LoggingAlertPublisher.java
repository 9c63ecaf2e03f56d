package com.costwatch.analysis.monitoring;

import com.costwatch.analysis.anomaly.EnsembleAnomaly;
import com.costwatch.analysis.forecast.ForecastReport;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAlertPublisher implements AlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertPublisher.class);

    @Override
    public void publishAnomalies(List<EnsembleAnomaly> anomalies) {
        for (EnsembleAnomaly anomaly : anomalies) {
            log.warn("Cost anomaly alert: service={} date={} value={} severity={} confidence={} algorithms={}",
                    anomaly.label(),
                    anomaly.date(),
                    anomaly.value(),
                    anomaly.severity().id(),
                    String.format("%.3f", anomaly.confidence()),
                    anomaly.algorithms());
        }
    }

    @Override
    public void publishForecastChange(ForecastReport forecast) {
        log.warn("Forecast change alert: service={} horizon={} predictedTotal={} accuracy={} changes={}",
                forecast.serviceName(),
                forecast.horizon(),
                String.format("%.2f", forecast.summary().predictedTotal()),
                String.format("%.3f", forecast.ensembleAccuracy()),
                forecast.insights().significantChanges().size());
    }
}
