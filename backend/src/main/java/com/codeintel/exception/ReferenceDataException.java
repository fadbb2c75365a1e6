package com.codeintel.exception;

/**
 * Program reference data (approved technologies, DRG/APC base payments) is missing or unreadable.
 * Thrown during startup only.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
