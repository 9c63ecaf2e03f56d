package com.costwatch.analysis.forecast;

import java.util.List;
import java.util.Map;

public record ScenarioAnalysis(
        ForecastOutcome baseline,
        List<ScenarioResult> scenarios,
        List<String> failedScenarios
) {

    /**
     * @param adjustments service label to cost multiplier; unlisted services keep their cost
     */
    public record Scenario(String name, Map<String, Double> adjustments) {
        public Scenario {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("scenario name is required");
            }
            adjustments = adjustments == null ? Map.of() : Map.copyOf(adjustments);
        }
    }

    public record ScenarioResult(
            String name,
            Map<String, Double> adjustments,
            ForecastReport forecast,
            double totalCost,
            double averageDailyCost,
            Impact impact
    ) {
    }

    public record Impact(double absolute, double percentage, String classification) {

        public static Impact between(double baselineTotal, double scenarioTotal) {
            double absolute = scenarioTotal - baselineTotal;
            double percentage = baselineTotal == 0d ? 0d : absolute / baselineTotal * 100d;
            String classification = Math.abs(percentage) > 30d ? "high" : Math.abs(percentage) > 10d ? "medium" : "low";
            return new Impact(absolute, percentage, classification);
        }
    }
}
