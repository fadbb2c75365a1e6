package com.codeintel.dto.response;

import com.codeintel.exception.FieldError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body for every non-2xx API response.
 *
 * @param code    machine-readable error kind, e.g. VALIDATION_ERROR
 * @param details per-field problems; validation errors only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(boolean error, String code, String message, List<FieldError> details) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(true, code, message, null);
    }

    public static ErrorResponse of(String code, String message, List<FieldError> details) {
        return new ErrorResponse(true, code, message, details);
    }
}
