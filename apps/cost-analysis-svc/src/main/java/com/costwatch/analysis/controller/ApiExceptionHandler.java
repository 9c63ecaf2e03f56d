package com.costwatch.analysis.controller;

import com.costwatch.analysis.controller.dto.ErrorResponseDto;
import com.costwatch.analysis.forecast.ForecastOutcome;
import com.costwatch.analysis.forecast.NoViableModelException;
import com.costwatch.analysis.model.InsufficientDataException;
import com.costwatch.analysis.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof MethodArgumentNotValidException invalid) {
            invalid.getBindingResult().getFieldErrors()
                    .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        }
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Malformed request body",
                Map.of("reason", cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage()));
    }

    @ExceptionHandler(ForecastUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleForecastUnavailable(ForecastUnavailableException ex) {
        ForecastOutcome outcome = ex.outcome();
        Map<String, Object> details = new LinkedHashMap<>();
        if (outcome.requiredDataPoints() != null) {
            details.put("requiredDataPoints", outcome.requiredDataPoints());
            details.put("actualDataPoints", outcome.actualDataPoints());
        }
        return build(HttpStatus.UNPROCESSABLE_ENTITY, outcome.status().name(), outcome.error(), details);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponseDto> handleInsufficientData(InsufficientDataException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_DATA", ex.getMessage(), Map.of(
                "requiredDataPoints", ex.requiredDataPoints(),
                "actualDataPoints", ex.actualDataPoints()
        ));
    }

    @ExceptionHandler(NoViableModelException.class)
    public ResponseEntity<ErrorResponseDto> handleNoViableModel(NoViableModelException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "NO_VIABLE_MODEL", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
