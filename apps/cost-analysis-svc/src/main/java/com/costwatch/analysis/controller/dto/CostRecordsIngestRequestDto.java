package com.costwatch.analysis.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record CostRecordsIngestRequestDto(@NotEmpty List<@Valid CostRecordDto> records) {
}
