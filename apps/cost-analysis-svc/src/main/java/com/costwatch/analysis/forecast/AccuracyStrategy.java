package com.costwatch.analysis.forecast;

/**
 * How per-model accuracy is scored before weighting.
 */
public enum AccuracyStrategy {
    /** Heuristic from model type, series volatility and length. */
    ESTIMATED,
    /** Refit on a training prefix and score against the held-out tail. */
    BACKTEST
}
