package com.costwatch.analysis.controller.dto;

import com.costwatch.analysis.forecast.AccuracyStrategy;
import com.costwatch.analysis.forecast.ForecastModelType;
import com.costwatch.analysis.forecast.ForecastOptions;
import java.util.List;

public record ForecastOptionsDto(
        Integer horizon,
        Double confidenceLevel,
        String serviceName,
        List<ForecastModelType> models,
        Boolean realTime,
        AccuracyStrategy accuracyStrategy
) {
    public static ForecastOptions resolve(ForecastOptionsDto dto, ForecastOptions defaults) {
        if (dto == null) {
            return defaults;
        }
        return new ForecastOptions(
                dto.horizon() != null ? dto.horizon() : defaults.horizon(),
                dto.confidenceLevel() != null ? dto.confidenceLevel() : defaults.confidenceLevel(),
                dto.serviceName() != null ? dto.serviceName() : defaults.serviceName(),
                dto.models() != null && !dto.models().isEmpty() ? dto.models() : defaults.models(),
                dto.realTime() != null ? dto.realTime() : defaults.realTime(),
                dto.accuracyStrategy() != null ? dto.accuracyStrategy() : defaults.accuracyStrategy()
        );
    }
}
