package com.codeintel.exception;

/**
 * A query reached the code index before loading finished.
 * Distinguishes "not initialized" from "no matching data".
 */
public class IndexNotReadyException extends RuntimeException {

    public IndexNotReadyException() {
        super("Code index is not ready; data is still loading or failed to load");
    }
}
