package com.largomodo.zipbundle.core.domain;

import java.util.Arrays;

/**
 * An assembled archive together with the file name it should be offered under.
 *
 * @param fileName Suggested download name, e.g. "ai-generated-42.zip"
 * @param content  Complete archive bytes
 */
public record BundleFile(String fileName, byte[] content) {

    public BundleFile {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BundleFile other)) return false;
        return fileName.equals(other.fileName) && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * fileName.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BundleFile[fileName=" + fileName + ", size=" + content.length + "]";
    }
}
