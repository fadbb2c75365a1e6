package com.codeintel.exception;

/**
 * The requested code is not present in the index.
 */
public class CodeNotFoundException extends RuntimeException {

    private final String code;

    public CodeNotFoundException(String code) {
        super("Code not found: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
