package com.costwatch.analysis.controller.dto;

import com.costwatch.analysis.anomaly.AnomalyAlgorithm;
import com.costwatch.analysis.anomaly.AnomalyDetectionOptions;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.util.List;

public record AnomalyOptionsDto(
        @Positive Double threshold,
        List<AnomalyAlgorithm> algorithms,
        @Min(1) Integer minDataPoints,
        Boolean realTime
) {
    public static AnomalyDetectionOptions resolve(AnomalyOptionsDto dto, AnomalyDetectionOptions defaults) {
        if (dto == null) {
            return defaults;
        }
        return new AnomalyDetectionOptions(
                dto.threshold() != null ? dto.threshold() : defaults.threshold(),
                dto.algorithms() != null && !dto.algorithms().isEmpty() ? dto.algorithms() : defaults.algorithms(),
                dto.minDataPoints() != null ? dto.minDataPoints() : defaults.minDataPoints(),
                dto.realTime() != null ? dto.realTime() : defaults.realTime()
        );
    }
}
