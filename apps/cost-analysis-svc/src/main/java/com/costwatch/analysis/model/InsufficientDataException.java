package com.costwatch.analysis.model;

public class InsufficientDataException extends RuntimeException {

    private final int requiredDataPoints;
    private final int actualDataPoints;

    public InsufficientDataException(int requiredDataPoints, int actualDataPoints) {
        super("Insufficient historical data: required=" + requiredDataPoints + ", actual=" + actualDataPoints);
        this.requiredDataPoints = requiredDataPoints;
        this.actualDataPoints = actualDataPoints;
    }

    public int requiredDataPoints() {
        return requiredDataPoints;
    }

    public int actualDataPoints() {
        return actualDataPoints;
    }
}
