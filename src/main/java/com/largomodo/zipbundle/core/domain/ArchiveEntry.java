package com.largomodo.zipbundle.core.domain;

import com.largomodo.zipbundle.core.InvalidEntryException;

import java.util.Arrays;

/**
 * Immutable (name, payload) pair awaiting assembly into an archive.
 * <p>
 * Size, checksum and header offset are derived when the archive is assembled,
 * not stored here. The payload is copied on the way in and on the way out so that
 * callers cannot change an entry after it has been added.
 * </p>
 *
 * @param name    Path-like entry name, using '/' as separator
 * @param payload Raw bytes stored verbatim in the archive
 */
public record ArchiveEntry(String name, byte[] payload) {

    /**
     * @throws InvalidEntryException if name is null/empty or payload is null
     */
    public ArchiveEntry {
        if (name == null || name.isEmpty()) {
            throw new InvalidEntryException("Entry name must not be empty");
        }
        if (payload == null) {
            throw new InvalidEntryException("Entry payload must not be null: " + name);
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Payload length in bytes. Equals the compressed size, since entries are stored.
     */
    public int size() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArchiveEntry other)) return false;
        return name.equals(other.name) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ArchiveEntry[name=" + name + ", size=" + payload.length + "]";
    }
}
