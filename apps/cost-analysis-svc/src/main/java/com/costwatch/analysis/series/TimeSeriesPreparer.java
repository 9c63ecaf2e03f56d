package com.costwatch.analysis.series;

import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.model.InsufficientDataException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class TimeSeriesPreparer {

    public static final int ANOMALY_MIN_DATA_POINTS = 7;
    public static final int FORECAST_MIN_DATA_POINTS = 14;

    /**
     * Drops records without a usable timestamp or amount, sorts the rest by timestamp (stable, so ties
     * keep their input order) and derives calendar fields in UTC.
     *
     * @throws InsufficientDataException when fewer than {@code minDataPoints} usable records remain
     */
    public PreparedSeries prepare(List<CostRecord> records, int minDataPoints) {
        PreparedSeries series = prepare(records);
        if (series.size() < minDataPoints) {
            throw new InsufficientDataException(minDataPoints, series.size());
        }
        return series;
    }

    public PreparedSeries prepare(List<CostRecord> records) {
        if (records == null || records.isEmpty()) {
            return new PreparedSeries(List.of());
        }
        List<CostRecord> usable = records.stream()
                .filter(record -> record != null && record.timestamp() != null)
                .filter(record -> record.amount() != null)
                .sorted(Comparator.comparing(CostRecord::timestamp))
                .toList();
        List<PreparedPoint> points = new ArrayList<>(usable.size());
        for (CostRecord record : usable) {
            ZonedDateTime at = record.timestamp().atZone(ZoneOffset.UTC);
            points.add(new PreparedPoint(
                    points.size(),
                    record.timestamp(),
                    at.toLocalDate(),
                    record.amount().doubleValue(),
                    at.getDayOfWeek(),
                    at.getDayOfMonth(),
                    at.getHour(),
                    record
            ));
        }
        return new PreparedSeries(points);
    }
}
