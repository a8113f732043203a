package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.controller.dto.ErrorResponseDto;
import com.costwatch.anomaly.model.GroupingDimensions;
import com.costwatch.anomaly.model.InvalidConfigurationException;
import com.costwatch.anomaly.model.InvalidGroupingException;
import com.costwatch.anomaly.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidGroupingException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidGrouping(InvalidGroupingException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_GROUPING", ex.getMessage(),
                Map.of("supported", GroupingDimensions.supportedLabels()));
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidConfiguration(InvalidConfigurationException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponseDto> handleBadParameter(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponseDto> handleDataAccess(DataAccessException ex) {
        log.warn("Cost store query failed: {}", ex.getMostSpecificCause().getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Cost store temporarily unavailable", details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.currentTraceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
