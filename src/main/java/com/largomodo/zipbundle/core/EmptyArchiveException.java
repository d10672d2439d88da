package com.largomodo.zipbundle.core;

/**
 * Thrown when an archive without entries is assembled under {@link EmptyArchivePolicy#REJECT}.
 */
public class EmptyArchiveException extends ArchiveException {

    public EmptyArchiveException(String message) {
        super(message);
    }
}
