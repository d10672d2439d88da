package com.largomodo.zipbundle.core;

/**
 * Base type for archive assembly failures.
 * <p>
 * RuntimeException enables fail-fast validation without catch blocks at every call site.
 * All subtypes describe caller-input errors: retrying the same call yields the same failure.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
