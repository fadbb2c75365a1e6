package com.codeintel.exception;

import java.util.List;

/**
 * Caller supplied malformed or missing input. Carries every rejected field, not just the first.
 */
public class RequestValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public RequestValidationException(List<FieldError> errors) {
        super("Validation failed: " + describe(errors));
        this.errors = List.copyOf(errors);
    }

    public static RequestValidationException of(String field, String message) {
        return new RequestValidationException(List.of(new FieldError(field, message)));
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    private static String describe(List<FieldError> errors) {
        return errors.stream()
            .map(error -> error.field() + " " + error.message())
            .reduce((a, b) -> a + "; " + b)
            .orElse("no details");
    }
}
