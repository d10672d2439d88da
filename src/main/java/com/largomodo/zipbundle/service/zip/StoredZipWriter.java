package com.largomodo.zipbundle.service.zip;

import com.largomodo.zipbundle.core.ArchiveOptions;
import com.largomodo.zipbundle.core.EmptyArchiveException;
import com.largomodo.zipbundle.core.EmptyArchivePolicy;
import com.largomodo.zipbundle.core.SizeLimitExceededException;
import com.largomodo.zipbundle.core.domain.Archive;
import com.largomodo.zipbundle.core.domain.ArchiveEntry;
import com.largomodo.zipbundle.service.ArchiveWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Native Java implementation writing ZIP archives entirely in memory.
 * <p>
 * Assembly runs in two passes over the entries, in insertion order:
 * <ol>
 *   <li>Layout pass: each entry's local header and data are emitted while a running offset
 *       records where that header starts</li>
 *   <li>Index pass: one central directory record per entry, pointing back at the recorded offset</li>
 * </ol>
 * followed by the end of central directory record. The running offset is local to
 * {@link #assemble(Archive)}, so one writer can serve any number of threads.
 * <p>
 * Classic (non-Zip64) layout only: every count fits 16 bits, every size and offset 32 bits.
 * The output buffer is a Java array, which caps the archive at {@code Integer.MAX_VALUE - 8} bytes.
 */
public class StoredZipWriter implements ArchiveWriter {

    private static final Logger log = LoggerFactory.getLogger(StoredZipWriter.class);

    private final ArchiveOptions options;
    private final PayloadCodec codec;
    private final long maxArchiveSize;

    private final LocalFileHeaderEncoder localEncoder = new LocalFileHeaderEncoder();
    private final CentralDirectoryEncoder centralEncoder = new CentralDirectoryEncoder();
    private final EndOfCentralDirectoryEncoder endEncoder = new EndOfCentralDirectoryEncoder();

    public StoredZipWriter() {
        this(ArchiveOptions.defaults());
    }

    public StoredZipWriter(ArchiveOptions options) {
        this(options, new StoredPayloadCodec());
    }

    public StoredZipWriter(ArchiveOptions options, PayloadCodec codec) {
        this(options, codec, Math.min(ZipConstants.MAX_UINT32, ZipConstants.MAX_BUFFER_SIZE));
    }

    /**
     * Accepts a custom archive size ceiling so overflow handling can be tested without
     * allocating gigabytes.
     */
    StoredZipWriter(ArchiveOptions options, PayloadCodec codec, long maxArchiveSize) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec must not be null");
        }
        this.options = options;
        this.codec = codec;
        this.maxArchiveSize = maxArchiveSize;
    }

    @Override
    public byte[] assemble(Archive archive) {
        List<ArchiveEntry> entries = archive.entries();

        if (entries.isEmpty() && options.emptyArchivePolicy() == EmptyArchivePolicy.REJECT) {
            throw new EmptyArchiveException("Archive has no entries");
        }
        if (entries.size() > ZipConstants.MAX_UINT16) {
            throw new SizeLimitExceededException("Too many entries for a non-Zip64 archive",
                    ZipConstants.MAX_UINT16, entries.size());
        }

        DosDateTime timestamp = DosDateTime.of(options.modificationTime());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        List<EntryLayout> layouts = new ArrayList<>(entries.size());

        // Pass 1: local headers and data
        long offset = 0;
        for (ArchiveEntry entry : entries) {
            EntryLayout layout = layOut(entry, timestamp, offset);
            long end = offset + layout.localRecordLength();
            requireWithinLimit(end, "Archive size after entry '" + entry.name() + "'");

            out.writeBytes(localEncoder.encode(layout));
            layouts.add(layout);

            log.debug("Placed {} at offset {} ({} bytes, crc {})",
                    entry.name(), offset, layout.uncompressedSize(), Long.toHexString(layout.crc32()));
            offset = end;
        }

        // Pass 2: central directory
        long directoryOffset = offset;
        long directorySize = 0;
        for (EntryLayout layout : layouts) {
            directorySize += layout.centralRecordLength();
            requireWithinLimit(directoryOffset + directorySize + ZipConstants.END_OF_CENTRAL_DIRECTORY_SIZE,
                    "Archive size including central directory");
            out.writeBytes(centralEncoder.encode(layout));
        }

        out.writeBytes(endEncoder.encode(layouts.size(), directorySize, directoryOffset));

        log.debug("Assembled {} entries: directory at {} ({} bytes), archive {} bytes",
                layouts.size(), directoryOffset, directorySize, out.size());
        return out.toByteArray();
    }

    /**
     * Derive the header fields of one entry. Runs before any of its bytes are written.
     */
    private EntryLayout layOut(ArchiveEntry entry, DosDateTime timestamp, long offset) {
        byte[] name = entry.name().getBytes(StandardCharsets.UTF_8);
        if (name.length > ZipConstants.MAX_UINT16) {
            throw new SizeLimitExceededException("Entry name too long: " + abbreviate(entry.name()),
                    ZipConstants.MAX_UINT16, name.length);
        }

        byte[] payload = entry.payload();
        CRC32 crc = new CRC32();
        crc.update(payload);

        byte[] data = codec.encode(payload);
        int flags = options.utf8FlagPolicy().requiresFlag(entry.name()) ? ZipConstants.FLAG_UTF8 : 0;

        return new EntryLayout(name, flags, codec.method(), timestamp.time(), timestamp.date(),
                crc.getValue(), payload.length, data, offset);
    }

    private void requireWithinLimit(long value, String what) {
        if (value > maxArchiveSize) {
            throw new SizeLimitExceededException(what + " exceeds the non-Zip64 limit", maxArchiveSize, value);
        }
    }

    // Names can be 64K long; keep messages readable
    private static String abbreviate(String name) {
        return name.length() <= 64 ? name : name.substring(0, 61) + "...";
    }
}
