package com.costwatch.analysis.controller;

import com.costwatch.analysis.anomaly.AnomalyAlgorithm;
import com.costwatch.analysis.config.CostwatchProperties;
import com.costwatch.analysis.controller.dto.BatchForecastRequestDto;
import com.costwatch.analysis.controller.dto.CapabilitiesResponseDto;
import com.costwatch.analysis.controller.dto.ForecastOptionsDto;
import com.costwatch.analysis.controller.dto.ForecastRequestDto;
import com.costwatch.analysis.controller.dto.ScenarioRequestDto;
import com.costwatch.analysis.forecast.AccuracyStrategy;
import com.costwatch.analysis.forecast.BatchForecastResult;
import com.costwatch.analysis.forecast.ForecastModelType;
import com.costwatch.analysis.forecast.ForecastOptions;
import com.costwatch.analysis.forecast.ForecastOutcome;
import com.costwatch.analysis.forecast.ForecastService;
import com.costwatch.analysis.forecast.ScenarioAnalysis;
import com.costwatch.analysis.forecast.ScenarioForecastService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/forecasting")
public class ForecastingController {

    private final ForecastService forecastService;
    private final ScenarioForecastService scenarioService;
    private final CostwatchProperties.Forecast settings;
    private final ForecastOptions defaults;

    public ForecastingController(
            ForecastService forecastService,
            ScenarioForecastService scenarioService,
            CostwatchProperties properties
    ) {
        this.forecastService = forecastService;
        this.scenarioService = scenarioService;
        this.settings = properties.forecast();
        this.defaults = settings.toOptions();
    }

    @PostMapping("/generate")
    public ResponseEntity<ForecastOutcome> generate(@Valid @RequestBody ForecastRequestDto request) {
        ForecastOptions options = ForecastOptionsDto.resolve(request.options(), defaults);
        ForecastOutcome outcome = forecastService.generateForecast(AnomalyController.toModel(request.records()), options);
        if (!outcome.success()) {
            throw new ForecastUnavailableException(outcome);
        }
        return ResponseEntity.ok(outcome);
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchForecastResult> batch(@Valid @RequestBody BatchForecastRequestDto request) {
        ForecastOptions base = request.confidenceLevel() != null
                ? defaults.withConfidenceLevel(request.confidenceLevel())
                : defaults;
        List<ForecastOptions> requests = request.services().stream()
                .map(service -> {
                    ForecastOptions options = base.withServiceName(service.serviceName());
                    if (service.horizon() != null) {
                        options = options.withHorizon(service.horizon());
                    }
                    if (service.models() != null && !service.models().isEmpty()) {
                        options = options.withModels(service.models());
                    }
                    return options;
                })
                .toList();
        return ResponseEntity.ok(forecastService.generateBatch(AnomalyController.toModel(request.records()), requests));
    }

    @PostMapping("/scenario")
    public ResponseEntity<ScenarioAnalysis> scenario(@Valid @RequestBody ScenarioRequestDto request) {
        ForecastOptions options = defaults;
        if (request.horizon() != null) {
            options = options.withHorizon(request.horizon());
        }
        if (request.confidenceLevel() != null) {
            options = options.withConfidenceLevel(request.confidenceLevel());
        }
        List<ScenarioAnalysis.Scenario> scenarios = request.scenarios().stream()
                .map(scenario -> new ScenarioAnalysis.Scenario(scenario.name(), scenario.adjustments()))
                .toList();
        ScenarioAnalysis analysis = scenarioService.analyse(AnomalyController.toModel(request.records()), scenarios, options);
        if (!analysis.baseline().success()) {
            throw new ForecastUnavailableException(analysis.baseline());
        }
        return ResponseEntity.ok(analysis);
    }

    @GetMapping("/capabilities")
    public ResponseEntity<CapabilitiesResponseDto> capabilities() {
        return ResponseEntity.ok(new CapabilitiesResponseDto(
                List.of(ForecastModelType.values()),
                List.of(AnomalyAlgorithm.values()),
                List.of(AccuracyStrategy.values()),
                settings.minHorizon(),
                settings.maxHorizon(),
                settings.minDataPoints(),
                settings.maxBatchSize(),
                settings.maxScenarios(),
                new CapabilitiesResponseDto.ConfidenceRangeDto(settings.minConfidence(), settings.maxConfidence())
        ));
    }
}
