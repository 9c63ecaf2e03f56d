package com.costwatch.analysis.forecast;

import java.util.List;

public record BatchForecastResult(List<Entry> successful, List<Entry> failed, Summary summary) {

    public record Entry(String serviceName, ForecastOutcome outcome) {
    }

    /**
     * @param averageAccuracy mean ensemble accuracy over successful services, 0 when none succeeded
     */
    public record Summary(int totalServices, int successCount, int failureCount, double averageAccuracy) {
    }
}
