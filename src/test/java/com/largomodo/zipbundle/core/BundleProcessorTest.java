package com.largomodo.zipbundle.core;

import com.largomodo.zipbundle.ZipContents;
import com.largomodo.zipbundle.core.domain.Archive;
import com.largomodo.zipbundle.core.domain.ArchiveEntry;
import com.largomodo.zipbundle.service.ArchiveWriter;
import com.largomodo.zipbundle.service.zip.StoredZipWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for input collection and output writing.
 */
class BundleProcessorTest {

    @TempDir
    Path tempDir;

    private final BundleProcessor processor = new BundleProcessor(new StoredZipWriter());

    @Test
    void filesBecomeEntriesNamedAfterThemInArgumentOrder() throws IOException {
        Path b = Files.write(tempDir.resolve("b.png"), new byte[]{2});
        Path a = Files.write(tempDir.resolve("a.png"), new byte[]{1});

        Archive archive = processor.collect(List.of(b, a), PayloadReader.RAW);

        assertEquals(List.of("b.png", "a.png"), names(archive));
        assertArrayEquals(new byte[]{2}, archive.entries().get(0).payload());
    }

    @Test
    void directoryWalkedRecursivelyWithFolderPrefix() throws IOException {
        Path photos = Files.createDirectories(tempDir.resolve("photos"));
        Files.createDirectories(photos.resolve("sub"));
        Files.write(photos.resolve("z.png"), new byte[]{1});
        Files.write(photos.resolve("a.png"), new byte[]{2});
        Files.write(photos.resolve("sub").resolve("c.png"), new byte[]{3});

        Archive archive = processor.collect(List.of(photos), PayloadReader.RAW);

        assertEquals(List.of("photos/a.png", "photos/sub/c.png", "photos/z.png"), names(archive));
    }

    @Test
    void outputInsideInputDirectoryIsNotCollected() throws IOException {
        Path photos = Files.createDirectories(tempDir.resolve("photos"));
        Files.write(photos.resolve("a.png"), new byte[]{1});
        Path target = photos.resolve("bundle.zip");

        processor.write(processor.collect(List.of(photos), PayloadReader.RAW, target), target);
        processor.write(processor.collect(List.of(photos), PayloadReader.RAW, target), target);

        Map<String, byte[]> contents = ZipContents.read(Files.readAllBytes(target));
        assertEquals(List.of("photos/a.png"), List.copyOf(contents.keySet()));
    }

    @Test
    void outputGivenAsInputFileIsSkipped() throws IOException {
        Path a = Files.write(tempDir.resolve("a.png"), new byte[]{1});
        Path target = Files.write(tempDir.resolve("bundle.zip"), new byte[]{9});

        Path sameFile = tempDir.resolve(".").resolve("bundle.zip");

        Archive archive = processor.collect(List.of(a, sameFile), PayloadReader.RAW, target);

        assertEquals(List.of("a.png"), names(archive));
    }

    @Test
    void emptyDirectoryYieldsEmptyArchive() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        assertTrue(processor.collect(List.of(empty), PayloadReader.RAW).isEmpty());
    }

    @Test
    void missingInputFails() {
        Path missing = tempDir.resolve("missing.png");

        IOException e = assertThrows(IOException.class, () -> processor.collect(List.of(missing), PayloadReader.RAW));
        assertTrue(e.getMessage().contains("missing.png"));
    }

    @Test
    void base64ReaderDecodesAndDropsSuffix() throws IOException {
        String encoded = "data:image/png;base64," + Base64.getEncoder().encodeToString(new byte[]{7, 8, 9});
        Path input = Files.writeString(tempDir.resolve("view.png.b64"), encoded + "\n");

        Archive archive = processor.collect(List.of(input), PayloadReader.BASE64);

        assertEquals(List.of("view.png"), names(archive));
        assertArrayEquals(new byte[]{7, 8, 9}, archive.entries().get(0).payload());
    }

    @Test
    void duplicateNamesAreKeptInOrder() throws IOException {
        Path first = Files.createDirectories(tempDir.resolve("one"));
        Path second = Files.createDirectories(tempDir.resolve("two"));
        Path a1 = Files.write(first.resolve("a.png"), new byte[]{1});
        Path a2 = Files.write(second.resolve("a.png"), new byte[]{2});

        Archive archive = processor.collect(List.of(a1, a2), PayloadReader.RAW);

        assertEquals(List.of("a.png", "a.png"), names(archive));
    }

    @Test
    void writeProducesReadableArchiveAndNoTempFiles() throws IOException {
        Archive archive = new Archive().addEntry("hello.txt", "hello".getBytes(StandardCharsets.US_ASCII));
        Path target = tempDir.resolve("out").resolve("bundle.zip");

        long size = processor.write(archive, target);

        assertEquals(Files.size(target), size);
        Map<String, byte[]> contents = ZipContents.read(Files.readAllBytes(target));
        assertArrayEquals("hello".getBytes(StandardCharsets.US_ASCII), contents.get("hello.txt"));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(List.of(target), files.collect(Collectors.toList()));
        }
    }

    @Test
    void writeReplacesExistingTarget() throws IOException {
        Path target = Files.write(tempDir.resolve("bundle.zip"), new byte[]{0, 0, 0});

        processor.write(new Archive().addEntry("a", new byte[]{1}), target);

        assertEquals(1, ZipContents.read(Files.readAllBytes(target)).size());
    }

    @Test
    void assemblyFailureLeavesExistingTargetUntouched() throws IOException {
        ArchiveWriter failing = mock(ArchiveWriter.class);
        when(failing.assemble(any(Archive.class))).thenThrow(new EmptyArchiveException("no entries"));
        Path target = Files.write(tempDir.resolve("bundle.zip"), new byte[]{1, 2, 3});

        BundleProcessor failingProcessor = new BundleProcessor(failing);

        assertThrows(EmptyArchiveException.class, () -> failingProcessor.write(new Archive(), target));
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(target));
    }

    @Test
    void readPayloadRejectsDirectories() {
        assertThrows(IOException.class, () -> processor.readPayload(tempDir, PayloadReader.RAW));
    }

    private static List<String> names(Archive archive) {
        return archive.entries().stream().map(ArchiveEntry::name).collect(Collectors.toList());
    }
}
