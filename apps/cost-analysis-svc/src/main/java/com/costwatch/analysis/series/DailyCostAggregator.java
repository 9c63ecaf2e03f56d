package com.costwatch.analysis.series;

import com.costwatch.analysis.model.CostRecord;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Collapses billing records into one record per UTC day so forecasts see a daily series.
 */
@Component
public class DailyCostAggregator {

    public static final String TOTAL = "Total";

    /**
     * @param serviceName a label to keep, or {@code null}/{@value #TOTAL} to sum every service
     */
    public List<CostRecord> aggregate(List<CostRecord> records, String serviceName) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        boolean total = serviceName == null || serviceName.isBlank() || TOTAL.equalsIgnoreCase(serviceName);
        String label = total ? TOTAL : serviceName;
        Map<LocalDate, BigDecimal> byDay = new TreeMap<>();
        for (CostRecord record : records) {
            if (record == null || record.timestamp() == null || record.amount() == null) {
                continue;
            }
            if (!total && !serviceName.equals(record.label())) {
                continue;
            }
            LocalDate date = record.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
            byDay.merge(date, record.amount(), BigDecimal::add);
        }
        List<CostRecord> daily = new ArrayList<>(byDay.size());
        byDay.forEach((date, amount) -> daily.add(
                CostRecord.of(date.atStartOfDay(ZoneOffset.UTC).toInstant(), label, amount)));
        return daily;
    }
}
