package com.costwatch.analysis.forecast;

public record ModelContribution(double value, double weight) {
}
