package com.costwatch.analysis.controller;

import com.costwatch.analysis.anomaly.AnomalyDetectionOptions;
import com.costwatch.analysis.anomaly.AnomalyDetectionService;
import com.costwatch.analysis.anomaly.AnomalyReport;
import com.costwatch.analysis.anomaly.AnomalyReportGenerator;
import com.costwatch.analysis.anomaly.EnsembleAnomaly;
import com.costwatch.analysis.config.CostwatchProperties;
import com.costwatch.analysis.controller.dto.AnomalyDetectRequestDto;
import com.costwatch.analysis.controller.dto.AnomalyDetectResponseDto;
import com.costwatch.analysis.controller.dto.AnomalyOptionsDto;
import com.costwatch.analysis.controller.dto.AnomalyReportRequestDto;
import com.costwatch.analysis.controller.dto.CostRecordDto;
import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Objects;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;
    private final AnomalyReportGenerator reportGenerator;
    private final AnomalyDetectionOptions defaults;

    public AnomalyController(
            AnomalyDetectionService detectionService,
            AnomalyReportGenerator reportGenerator,
            CostwatchProperties properties
    ) {
        this.detectionService = detectionService;
        this.reportGenerator = reportGenerator;
        this.defaults = properties.anomaly().toOptions();
    }

    @PostMapping("/detect")
    public ResponseEntity<AnomalyDetectResponseDto> detect(@Valid @RequestBody AnomalyDetectRequestDto request) {
        AnomalyDetectionOptions options = AnomalyOptionsDto.resolve(request.options(), defaults);
        List<CostRecord> records = toModel(request.records());
        List<EnsembleAnomaly> anomalies = Boolean.TRUE.equals(request.perService())
                ? detectionService.detectServiceAnomalies(records, options)
                : detectionService.detectAnomalies(records, options);
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(new AnomalyDetectResponseDto(anomalies.size(), anomalies, traceId));
    }

    @PostMapping("/report")
    public ResponseEntity<AnomalyReport> report(@Valid @RequestBody AnomalyReportRequestDto request) {
        AnomalyDetectionOptions options = AnomalyOptionsDto.resolve(request.options(), defaults);
        List<EnsembleAnomaly> anomalies = detectionService.detectServiceAnomalies(toModel(request.records()), options);
        AnomalyReport.DateRange range = request.from() != null || request.to() != null
                ? new AnomalyReport.DateRange(request.from(), request.to())
                : null;
        return ResponseEntity.ok(reportGenerator.generate(List.of(anomalies), range));
    }

    static List<CostRecord> toModel(List<CostRecordDto> records) {
        return records.stream().filter(Objects::nonNull).map(CostRecordDto::toModel).toList();
    }
}
