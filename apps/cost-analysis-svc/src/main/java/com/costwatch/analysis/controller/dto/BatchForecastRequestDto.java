package com.costwatch.analysis.controller.dto;

import com.costwatch.analysis.forecast.ForecastModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BatchForecastRequestDto(
        @NotNull List<@Valid CostRecordDto> records,
        @NotEmpty List<@Valid ServiceRequestDto> services,
        Double confidenceLevel
) {
    public record ServiceRequestDto(
            @NotBlank String serviceName,
            Integer horizon,
            List<ForecastModelType> models
    ) {
    }
}
