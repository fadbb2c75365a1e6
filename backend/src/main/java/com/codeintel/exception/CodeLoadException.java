package com.codeintel.exception;

/**
 * Source data is missing or malformed. Fatal: startup must abort rather than
 * serve from a partially built index.
 */
public class CodeLoadException extends RuntimeException {

    public CodeLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public CodeLoadException(String message) {
        super(message);
    }
}
