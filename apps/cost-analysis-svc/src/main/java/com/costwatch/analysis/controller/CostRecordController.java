package com.costwatch.analysis.controller;

import com.costwatch.analysis.controller.dto.CostRecordsIngestRequestDto;
import com.costwatch.analysis.controller.dto.CostRecordsIngestResponseDto;
import com.costwatch.analysis.monitoring.InMemoryCostRecordSource;
import com.costwatch.analysis.web.RequestContextHolder;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Feeds the buffer that scheduled monitoring reads from.
 */
@RestController
@RequestMapping("/cost-records")
public class CostRecordController {

    private static final Logger log = LoggerFactory.getLogger(CostRecordController.class);

    private final InMemoryCostRecordSource recordSource;

    public CostRecordController(InMemoryCostRecordSource recordSource) {
        this.recordSource = recordSource;
    }

    @PostMapping
    public ResponseEntity<CostRecordsIngestResponseDto> ingest(@Valid @RequestBody CostRecordsIngestRequestDto request) {
        int accepted = recordSource.append(AnomalyController.toModel(request.records()));
        log.info("Buffered {} of {} cost records", accepted, request.records().size());
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new CostRecordsIngestResponseDto(accepted, recordSource.size(), traceId));
    }
}
