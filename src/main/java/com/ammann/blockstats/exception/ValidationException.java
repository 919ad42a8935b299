package com.ammann.blockstats.exception;

import java.util.List;

/**
 * Exception indicating that a client-supplied parameter or message does not meet the
 * required constraints.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}; on the WebSocket
 * it becomes an {@code error} reply listing the {@link FieldError}s, and the connection stays
 * open.
 */
public class ValidationException extends ApiException {

    private final List<FieldError> errors;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<FieldError> errors) {
        super(message, null);
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected),
                List.of(new FieldError(paramName, "expected " + expected)));
    }

    /**
     * A single failed constraint.
     *
     * @param path dotted path of the offending field
     * @param message what was expected
     */
    public record FieldError(String path, String message) {}
}
