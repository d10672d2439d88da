package com.largomodo.zipbundle.core;

import com.largomodo.zipbundle.util.Base64Payloads;
import com.largomodo.zipbundle.util.EntryNames;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Strategy for turning an input file into an entry payload and its entry file name.
 */
public interface PayloadReader {

    /** Bytes are taken as-is. */
    PayloadReader RAW = new PayloadReader() {
        @Override
        public byte[] read(Path file) throws IOException {
            return Files.readAllBytes(file);
        }

        @Override
        public String entryFileName(String fileName) {
            return fileName;
        }
    };

    /** File content is base64 text or a data URL; a ".b64"/".base64" suffix is dropped from the name. */
    PayloadReader BASE64 = new PayloadReader() {
        @Override
        public byte[] read(Path file) throws IOException {
            return Base64Payloads.decode(Files.readString(file, StandardCharsets.US_ASCII));
        }

        @Override
        public String entryFileName(String fileName) {
            return EntryNames.stripEncodingSuffix(fileName);
        }
    };

    /**
     * @param file Regular file to read
     * @return payload bytes
     * @throws IOException if the file cannot be read
     */
    byte[] read(Path file) throws IOException;

    /**
     * @param fileName Name of the input file on disk
     * @return name the entry should carry inside the archive
     */
    String entryFileName(String fileName);
}
