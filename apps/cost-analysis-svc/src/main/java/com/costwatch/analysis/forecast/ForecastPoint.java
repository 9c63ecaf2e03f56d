package com.costwatch.analysis.forecast;

import java.time.LocalDate;

public record ForecastPoint(LocalDate date, double value, double confidence) {
}
