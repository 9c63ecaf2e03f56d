package com.costwatch.analysis.controller.dto;

public record CostRecordsIngestResponseDto(int accepted, int buffered, String traceId) {
}
