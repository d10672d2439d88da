package com.largomodo.zipbundle.core;

import com.largomodo.zipbundle.core.domain.Archive;
import com.largomodo.zipbundle.service.ArchiveWriter;
import com.largomodo.zipbundle.util.EntryNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-system side of bundling: gathers input files into an {@link Archive} and writes the
 * assembled archive to disk.
 * <p>
 * Coordinates:
 * 1. Collect regular files and walk directories (sorted, so repeated runs produce the same order)
 * 2. Assemble through the {@link ArchiveWriter}
 * 3. Write to a temporary sibling and move it over the target
 * <p>
 * The target is never left half-written: either the move happens or the old file stays.
 */
public class BundleProcessor {

    private static final Logger log = LoggerFactory.getLogger(BundleProcessor.class);

    private final ArchiveWriter writer;

    public BundleProcessor(ArchiveWriter writer) {
        this.writer = writer;
    }

    /**
     * Build an archive from files and directories.
     * <p>
     * A file becomes one entry named after the file. A directory contributes all regular files
     * below it, named by their path relative to the directory's parent, so "photos/a.png" keeps
     * its folder.
     *
     * @param inputs Files and directories, in the order their entries should appear
     * @param reader Payload decoding strategy
     * @return archive with one entry per collected file
     * @throws IOException if an input is missing, unreadable or not a file/directory
     */
    public Archive collect(List<Path> inputs, PayloadReader reader) throws IOException {
        return collect(inputs, reader, null);
    }

    /**
     * Same as {@link #collect(List, PayloadReader)}, but never collects the archive being written.
     * Rerunning with the output inside an input directory must not pack the previous archive.
     *
     * @param target Output file of this run, or null
     */
    public Archive collect(List<Path> inputs, PayloadReader reader, Path target) throws IOException {
        Path excluded = target == null ? null : target.toAbsolutePath().normalize();
        Archive archive = new Archive();
        Set<String> names = new HashSet<>();

        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new IOException("Input does not exist: " + input);
            }
            if (Files.isDirectory(input)) {
                addDirectory(archive, input, reader, names, excluded);
            } else if (isExcluded(input, excluded)) {
                log.warn("Skipping {}: it is the output archive", input);
            } else if (Files.isRegularFile(input)) {
                String name = reader.entryFileName(input.getFileName().toString());
                addFile(archive, input, name, reader, names);
            } else {
                throw new IOException("Input is neither a regular file nor a directory: " + input);
            }
        }

        log.debug("Collected {} entries from {} inputs", archive.size(), inputs.size());
        return archive;
    }

    /**
     * Read one payload for callers that lay out entries themselves.
     *
     * @throws IOException if file is not a readable regular file
     */
    public byte[] readPayload(Path file, PayloadReader reader) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Input is not a regular file: " + file);
        }
        return reader.read(file);
    }

    /**
     * Assemble the archive and write it to target.
     *
     * @param archive Entries to write
     * @param target  Output file, replaced if it exists
     * @return archive size in bytes
     * @throws IOException if the output cannot be written
     */
    public long write(Archive archive, Path target) throws IOException {
        byte[] content = writer.assemble(archive);
        writeAtomically(content, target);
        log.info("Wrote {} ({} entries, {} bytes)", target.getFileName(), archive.size(), content.length);
        return content.length;
    }

    /**
     * Write bytes to target through a temporary file in the same directory.
     */
    public void writeAtomically(byte[] content, Path target) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, ".zipbundle-", ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to plain move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void addDirectory(Archive archive, Path directory, PayloadReader reader, Set<String> names,
                              Path excluded) throws IOException {
        Path root = directory.toAbsolutePath().normalize();
        Path base = root.getParent() != null ? root.getParent() : root;

        List<Path> files;
        try (Stream<Path> stream = Files.walk(root)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(file -> !isExcluded(file, excluded))
                    .sorted()
                    .collect(Collectors.toList());
        }

        for (Path file : files) {
            Path relative = base.relativize(file);
            String fileName = reader.entryFileName(file.getFileName().toString());
            Path parent = relative.getParent();
            String name = parent == null
                    ? fileName
                    : EntryNames.fromRelativePath(parent) + "/" + fileName;
            addFile(archive, file, name, reader, names);
        }
    }

    private static boolean isExcluded(Path file, Path excluded) {
        return excluded != null && file.toAbsolutePath().normalize().equals(excluded);
    }

    private void addFile(Archive archive, Path file, String name, PayloadReader reader, Set<String> names)
            throws IOException {
        if (!names.add(name)) {
            // Format allows it, but most extractors silently keep only one copy
            log.warn("Duplicate entry name {} (from {})", name, file);
        }
        archive.addEntry(name, reader.read(file));
    }
}
