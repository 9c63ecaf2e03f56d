package com.costwatch.analysis.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ForecastRequestDto(
        @NotNull List<@Valid CostRecordDto> records,
        ForecastOptionsDto options
) {
}
