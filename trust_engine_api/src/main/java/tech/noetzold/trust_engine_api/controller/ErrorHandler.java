package tech.noetzold.trust_engine_api.controller;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.StaleSnapshotException;
import tech.noetzold.trust_engine_api.exception.StatusConflictException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(ConfigurationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleConfiguration(ConfigurationException ex) {
        log.warn("Configuration rejected: {}", ex.getMessage());
        return body("CONFIGURATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(UnknownReferenceException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownReference(UnknownReferenceException ex) {
        Map<String, Object> body = body("UNKNOWN_REFERENCE", ex.getMessage());
        body.put("reference", ex.getReference());
        return body;
    }

    @ExceptionHandler(StaleSnapshotException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleStaleSnapshot(StaleSnapshotException ex) {
        Map<String, Object> body = body("STALE_SNAPSHOT", ex.getMessage());
        body.put("current_mapping_version", ex.getCurrentVersion());
        return body;
    }

    @ExceptionHandler(StatusConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleStatusConflict(StatusConflictException ex) {
        return body("STATUS_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body("INVALID_REQUEST", detail.isEmpty() ? "Request validation failed" : detail);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMethodValidation(HandlerMethodValidationException ex) {
        return body("INVALID_REQUEST", "Request validation failed");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return body("INVALID_REQUEST", "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return body("INVALID_REQUEST", ex.getMessage());
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("trace_id", MDC.get("trace_id"));
        return body;
    }
}
