package com.largomodo.zipbundle.core.domain;

import com.largomodo.zipbundle.core.InvalidEntryException;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered collection of entries to be bundled into one archive.
 * <p>
 * Insertion order is the physical order of entries in the output and the order of the
 * central directory listing. Not thread-safe: fill it from one thread, then hand it to
 * an {@link com.largomodo.zipbundle.service.ArchiveWriter}, which only reads a snapshot.
 */
public class Archive {

    private final List<ArchiveEntry> entries = new ArrayList<>();

    /**
     * Append an entry.
     *
     * @param name    Entry name (non-empty)
     * @param payload Entry bytes (may be empty, must not be null)
     * @return this archive, for chaining
     * @throws InvalidEntryException if name is empty or payload is null
     */
    public Archive addEntry(String name, byte[] payload) {
        entries.add(new ArchiveEntry(name, payload));
        return this;
    }

    public Archive addEntry(ArchiveEntry entry) {
        if (entry == null) {
            throw new InvalidEntryException("Entry must not be null");
        }
        entries.add(entry);
        return this;
    }

    /**
     * @return unmodifiable snapshot of the entries in insertion order
     */
    public List<ArchiveEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
