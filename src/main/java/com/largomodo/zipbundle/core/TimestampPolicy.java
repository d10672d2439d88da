package com.largomodo.zipbundle.core;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Source of the modification time stamped on every entry of an archive.
 */
public enum TimestampPolicy {
    /** DOS epoch (1980-01-01 00:00). Output is byte-for-byte reproducible. */
    FIXED,
    /** Wall clock at the time the options are resolved. */
    NOW;

    public LocalDateTime resolve(Clock clock) {
        return switch (this) {
            case FIXED -> ArchiveOptions.DOS_EPOCH;
            case NOW -> LocalDateTime.now(clock);
        };
    }
}
