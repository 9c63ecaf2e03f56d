package com.costwatch.analysis.controller.dto;

import com.costwatch.analysis.model.CostRecord;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * @param date   {@code yyyy-MM-dd} or an ISO-8601 instant
 * @param amount may be null; such records are ignored by the analysis
 */
public record CostRecordDto(
        @NotBlank String date,
        String service,
        BigDecimal amount,
        String organization,
        String region
) {
    public CostRecord toModel() {
        return new CostRecord(parseTimestamp(date), service, amount, organization, region);
    }

    static Instant parseTimestamp(String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid date '" + value + "': expected yyyy-MM-dd or an ISO-8601 instant", ex);
        }
    }
}
