package com.costwatch.analysis.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

public record AnomalyReportRequestDto(
        @NotNull List<@Valid CostRecordDto> records,
        @Valid AnomalyOptionsDto options,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate from,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate to
) {
}
