package com.largomodo.zipbundle.core;

/**
 * Thrown when an archive exceeds the limits of the classic (non-Zip64) ZIP layout.
 * <p>
 * Covers names longer than 65535 encoded bytes, more than 65535 entries, and offsets or
 * sizes that do not fit a 32-bit field or the in-memory output buffer.
 */
public class SizeLimitExceededException extends ArchiveException {

    private final long limit;
    private final long actual;

    /**
     * @param message Description of the field that overflowed
     * @param limit   Largest value the field can hold
     * @param actual  Value that was about to be written
     */
    public SizeLimitExceededException(String message, long limit, long actual) {
        super(message + " (limit " + limit + ", got " + actual + ")");
        this.limit = limit;
        this.actual = actual;
    }

    public long getLimit() {
        return limit;
    }

    public long getActual() {
        return actual;
    }
}
