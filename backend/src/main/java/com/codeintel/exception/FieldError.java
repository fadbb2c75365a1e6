package com.codeintel.exception;

/**
 * One rejected input field and the reason it was rejected.
 */
public record FieldError(String field, String message) {}
