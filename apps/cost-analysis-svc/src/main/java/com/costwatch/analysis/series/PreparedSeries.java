package com.costwatch.analysis.series;

import java.time.LocalDate;
import java.util.List;

/**
 * Time-ordered observations; {@link PreparedPoint#index()} is the position in {@link #points()}
 * and is what every detector and model uses to refer to a point.
 */
public record PreparedSeries(List<PreparedPoint> points) {

    public PreparedSeries {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public PreparedPoint get(int index) {
        return points.get(index);
    }

    public double[] values() {
        return points.stream().mapToDouble(PreparedPoint::value).toArray();
    }

    public LocalDate lastDate() {
        if (points.isEmpty()) {
            throw new IllegalStateException("series is empty");
        }
        return points.get(points.size() - 1).date();
    }

    /**
     * First {@code length} points, re-indexed from zero. Used to refit models on a training prefix.
     */
    public PreparedSeries head(int length) {
        if (length < 0 || length > points.size()) {
            throw new IllegalArgumentException("length must be between 0 and " + points.size());
        }
        return new PreparedSeries(points.subList(0, length));
    }
}
