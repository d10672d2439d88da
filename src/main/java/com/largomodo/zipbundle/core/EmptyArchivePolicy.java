package com.largomodo.zipbundle.core;

/**
 * Decides what assembling an archive with zero entries does.
 */
public enum EmptyArchivePolicy {
    /** Produce a structurally valid archive holding only the 22-byte end record. */
    PERMIT,
    /** Fail with {@link EmptyArchiveException}. */
    REJECT
}
