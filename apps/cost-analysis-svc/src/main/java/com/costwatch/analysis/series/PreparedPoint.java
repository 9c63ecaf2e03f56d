package com.costwatch.analysis.series;

import com.costwatch.analysis.model.CostRecord;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;

public record PreparedPoint(
        int index,
        Instant timestamp,
        LocalDate date,
        double value,
        DayOfWeek dayOfWeek,
        int dayOfMonth,
        int hourOfDay,
        CostRecord source
) {
    public String label() {
        return source.labelOrUnknown();
    }
}
