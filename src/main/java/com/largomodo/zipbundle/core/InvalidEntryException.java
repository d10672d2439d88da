package com.largomodo.zipbundle.core;

/**
 * Thrown when an entry cannot be accepted into an archive: empty name, missing payload,
 * or a payload that cannot be decoded.
 */
public class InvalidEntryException extends ArchiveException {

    public InvalidEntryException(String message) {
        super(message);
    }

    public InvalidEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
