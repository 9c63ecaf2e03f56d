package com.costwatch.analysis.controller.dto;

import com.costwatch.analysis.anomaly.EnsembleAnomaly;
import java.util.List;

public record AnomalyDetectResponseDto(int count, List<EnsembleAnomaly> anomalies, String traceId) {
}
