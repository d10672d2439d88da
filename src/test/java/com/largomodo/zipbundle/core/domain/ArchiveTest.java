package com.largomodo.zipbundle.core.domain;

import com.largomodo.zipbundle.core.InvalidEntryException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveTest {

    @Test
    void entriesKeepInsertionOrder() {
        Archive archive = new Archive()
                .addEntry("c.png", new byte[]{3})
                .addEntry("a.png", new byte[]{1})
                .addEntry("b.png", new byte[]{2});

        List<String> names = archive.entries().stream().map(ArchiveEntry::name).collect(Collectors.toList());

        assertEquals(List.of("c.png", "a.png", "b.png"), names);
        assertEquals(3, archive.size());
        assertFalse(archive.isEmpty());
    }

    @Test
    void newArchiveIsEmpty() {
        Archive archive = new Archive();

        assertTrue(archive.isEmpty());
        assertEquals(0, archive.size());
        assertTrue(archive.entries().isEmpty());
    }

    @Test
    void emptyNameRejected() {
        Archive archive = new Archive();

        assertThrows(InvalidEntryException.class, () -> archive.addEntry("", new byte[1]));
        assertThrows(InvalidEntryException.class, () -> archive.addEntry(null, new byte[1]));
        assertTrue(archive.isEmpty(), "Rejected entries must not be added");
    }

    @Test
    void missingPayloadRejected() {
        Archive archive = new Archive();

        assertThrows(InvalidEntryException.class, () -> archive.addEntry("a.png", null));
        assertThrows(InvalidEntryException.class, () -> archive.addEntry((ArchiveEntry) null));
        assertTrue(archive.isEmpty());
    }

    @Test
    void emptyPayloadAccepted() {
        Archive archive = new Archive().addEntry("empty.bin", new byte[0]);

        assertEquals(0, archive.entries().get(0).size());
    }

    @Test
    void duplicateNamesAreKept() {
        Archive archive = new Archive()
                .addEntry("same.txt", new byte[]{1})
                .addEntry("same.txt", new byte[]{2});

        assertEquals(2, archive.size());
    }

    @Test
    void snapshotIsUnmodifiableAndDetached() {
        Archive archive = new Archive().addEntry("a", new byte[0]);
        List<ArchiveEntry> snapshot = archive.entries();

        archive.addEntry("b", new byte[0]);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new ArchiveEntry("c", new byte[0])));
    }
}
