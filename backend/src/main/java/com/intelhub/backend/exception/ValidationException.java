package com.intelhub.backend.exception;

import java.util.List;
import lombok.Getter;

/**
 * Rejected input, reported against the offending field.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final String field;
    private final Object providedValue;
    private final List<String> allowedValues;

    public ValidationException(String field, Object providedValue, String message) {
        this(field, providedValue, message, null);
    }

    public ValidationException(String field, Object providedValue, String message, List<String> allowedValues) {
        super(message);
        this.field = field;
        this.providedValue = providedValue;
        this.allowedValues = allowedValues;
    }
}
