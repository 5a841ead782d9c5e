package com.intelhub.backend.controller;

import com.fasterxml.jackson.core.JsonParseException;
import com.intelhub.backend.exception.IngestionException;
import com.intelhub.backend.exception.ItemNotFoundException;
import com.intelhub.backend.exception.StorageConflictException;
import com.intelhub.backend.exception.ValidationException;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = ex.getBindingResult().getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing + "; " + replacement
                ));

        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Validation failed",
                "message", "Please fix the following field errors:",
                "fieldErrors", fieldErrors
        ));
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<Map<String, Object>> handleParameterConstraints(Exception ex) {
        log.warn("⚠️ Parameter validation failed: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Validation failed",
                "message", String.valueOf(ex.getMessage())
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleJsonParseError(HttpMessageNotReadableException ex) {
        String message = "Invalid JSON format";
        if (ex.getCause() instanceof JsonParseException jsonEx) {
            message = "JSON parsing error: " + jsonEx.getOriginalMessage();
        }
        log.warn("⚠️ Unreadable request body: {}", ex.getMessage());

        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Invalid JSON",
                "message", message
        ));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Missing required parameter",
                "message", String.format("Required parameter '%s' is missing", ex.getParameterName()),
                "parameterName", ex.getParameterName()
        ));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Invalid parameter type",
                "message", String.format("Parameter '%s' should be of type %s but received: %s",
                        ex.getName(), expected, ex.getValue()),
                "parameterName", ex.getName()
        ));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleFieldValidation(ValidationException ex) {
        log.warn("⚠️ Field validation failed for {}: {}", ex.getField(), ex.getMessage());

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", "Field validation failed");
        response.put("field", ex.getField());
        response.put("providedValue", ex.getProvidedValue());
        response.put("message", ex.getMessage());
        if (ex.getAllowedValues() != null && !ex.getAllowedValues().isEmpty()) {
            response.put("allowedValues", ex.getAllowedValues());
        }
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(IngestionException ex) {
        log.warn("⚠️ Ingestion rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Ingestion rejected",
                "message", ex.getMessage()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", "Invalid argument",
                "message", ex.getMessage() != null ? ex.getMessage() : "Invalid argument provided"
        ));
    }

    @ExceptionHandler(ItemNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ItemNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "success", false,
                "error", "Not found",
                "message", ex.getMessage()
        ));
    }

    @ExceptionHandler(StorageConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(StorageConflictException ex) {
        log.error("🚨 CRITICAL storage conflict surfaced to API for item {}: {}", ex.getUuid(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "success", false,
                "error", "Storage conflict",
                "message", ex.getMessage()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("❌ Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "error", "Internal server error",
                "message", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()
        ));
    }
}
