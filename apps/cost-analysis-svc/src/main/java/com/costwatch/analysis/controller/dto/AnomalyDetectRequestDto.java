package com.costwatch.analysis.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * @param perService detect per service label instead of over one combined series
 */
public record AnomalyDetectRequestDto(
        @NotNull List<@Valid CostRecordDto> records,
        @Valid AnomalyOptionsDto options,
        Boolean perService
) {
}
