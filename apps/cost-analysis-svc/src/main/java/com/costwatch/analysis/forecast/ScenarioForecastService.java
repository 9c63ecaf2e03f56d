package com.costwatch.analysis.forecast;

import com.costwatch.analysis.config.CostwatchProperties;
import com.costwatch.analysis.model.CostRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * What-if forecasting: scales historical costs per service and compares the total forecast with the
 * unadjusted baseline.
 */
@Service
public class ScenarioForecastService {

    private static final Logger log = LoggerFactory.getLogger(ScenarioForecastService.class);

    private final ForecastService forecastService;
    private final int maxScenarios;

    public ScenarioForecastService(ForecastService forecastService, CostwatchProperties properties) {
        this.forecastService = forecastService;
        this.maxScenarios = properties.forecast().maxScenarios();
    }

    public ScenarioAnalysis analyse(List<CostRecord> records, List<ScenarioAnalysis.Scenario> scenarios, ForecastOptions baseOptions) {
        if (scenarios == null || scenarios.isEmpty()) {
            throw new IllegalArgumentException("Scenarios array is required");
        }
        if (scenarios.size() > maxScenarios) {
            throw new IllegalArgumentException("Maximum " + maxScenarios + " scenarios allowed per request");
        }
        ForecastOptions options = baseOptions.withServiceName(ForecastOptions.TOTAL_SERVICE);

        ForecastOutcome baseline = forecastService.generateForecast(records, options);
        if (!baseline.success()) {
            log.info("Baseline forecast unavailable ({}); skipping scenarios", baseline.status());
            return new ScenarioAnalysis(baseline, List.of(), List.of());
        }
        double baselineTotal = baseline.forecast().summary().predictedTotal();

        List<ScenarioAnalysis.ScenarioResult> results = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ScenarioAnalysis.Scenario scenario : scenarios) {
            ForecastOutcome outcome = forecastService.generateForecast(adjust(records, scenario), options);
            if (!outcome.success()) {
                log.warn("Scenario {} failed: {}", scenario.name(), outcome.error());
                failed.add(scenario.name());
                continue;
            }
            ForecastReport forecast = outcome.forecast();
            double total = forecast.summary().predictedTotal();
            results.add(new ScenarioAnalysis.ScenarioResult(
                    scenario.name(),
                    scenario.adjustments(),
                    forecast,
                    total,
                    forecast.summary().averageDailyCost(),
                    ScenarioAnalysis.Impact.between(baselineTotal, total)
            ));
        }
        log.info("Scenario analysis complete: {}/{} scenarios", results.size(), scenarios.size());
        return new ScenarioAnalysis(baseline, results, failed);
    }

    static List<CostRecord> adjust(List<CostRecord> records, ScenarioAnalysis.Scenario scenario) {
        return records.stream()
                .map(record -> {
                    Double multiplier = scenario.adjustments().get(record.labelOrUnknown());
                    if (multiplier == null || record.amount() == null) {
                        return record;
                    }
                    return record.withAmount(record.amount().multiply(BigDecimal.valueOf(multiplier)));
                })
                .toList();
    }
}
