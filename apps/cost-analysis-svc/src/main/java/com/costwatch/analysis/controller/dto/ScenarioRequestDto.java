package com.costwatch.analysis.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record ScenarioRequestDto(
        @NotNull List<@Valid CostRecordDto> records,
        @NotEmpty List<@Valid ScenarioDto> scenarios,
        Integer horizon,
        Double confidenceLevel
) {
    /**
     * @param adjustments service label to cost multiplier
     */
    public record ScenarioDto(@NotBlank String name, Map<String, Double> adjustments) {
    }
}
