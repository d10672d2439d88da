package com.largomodo.zipbundle.core;

import java.time.LocalDateTime;

/**
 * Immutable settings applied to every entry of an assembled archive.
 * <p>
 * Two assemblies of the same entry list with equal options produce identical bytes.
 *
 * @param modificationTime   Timestamp written as DOS time/date into local and central records
 * @param utf8FlagPolicy     When to set the UTF-8 name flag
 * @param emptyArchivePolicy What to do with an archive that has no entries
 */
public record ArchiveOptions(LocalDateTime modificationTime,
                             Utf8FlagPolicy utf8FlagPolicy,
                             EmptyArchivePolicy emptyArchivePolicy) {

    /** Earliest instant representable in the DOS date format. */
    public static final LocalDateTime DOS_EPOCH = LocalDateTime.of(1980, 1, 1, 0, 0);

    public ArchiveOptions {
        if (modificationTime == null) {
            throw new IllegalArgumentException("modificationTime must not be null");
        }
        if (utf8FlagPolicy == null) {
            throw new IllegalArgumentException("utf8FlagPolicy must not be null");
        }
        if (emptyArchivePolicy == null) {
            throw new IllegalArgumentException("emptyArchivePolicy must not be null");
        }
    }

    /**
     * Fixed DOS epoch timestamp, UTF-8 flag only where needed, empty archives permitted.
     */
    public static ArchiveOptions defaults() {
        return new ArchiveOptions(DOS_EPOCH, Utf8FlagPolicy.AUTO, EmptyArchivePolicy.PERMIT);
    }

    public ArchiveOptions withModificationTime(LocalDateTime time) {
        return new ArchiveOptions(time, utf8FlagPolicy, emptyArchivePolicy);
    }

    public ArchiveOptions withUtf8FlagPolicy(Utf8FlagPolicy policy) {
        return new ArchiveOptions(modificationTime, policy, emptyArchivePolicy);
    }

    public ArchiveOptions withEmptyArchivePolicy(EmptyArchivePolicy policy) {
        return new ArchiveOptions(modificationTime, utf8FlagPolicy, policy);
    }
}
