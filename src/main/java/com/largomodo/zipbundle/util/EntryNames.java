package com.largomodo.zipbundle.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Entry name construction for archive bundles.
 * <p>
 * Pure functions with no state or dependencies. Safe for concurrent use.
 */
public class EntryNames {

    private static final String[] ENCODING_SUFFIXES = {".b64", ".base64"};

    private EntryNames() {
        // Static utility class - prevent instantiation
    }

    /**
     * Turn a free-text label into a safe file name fragment.
     * <p>
     * Keeps ASCII letters, digits and CJK unified ideographs (U+4E00..U+9FA5); every other
     * UTF-16 unit becomes '_'. "Top View" → "Top_View", "侧面 45°" → "侧面_45_".
     * A character outside the BMP is two units and yields "__".
     *
     * @param label Display label, e.g. a perspective name
     * @return sanitized fragment of the same length
     * @throws IllegalArgumentException if label is null or blank
     */
    public static String sanitizeLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label cannot be null or blank");
        }
        StringBuilder result = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            result.append(isLabelChar(c) ? c : '_');
        }
        return result.toString();
    }

    private static boolean isLabelChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || (c >= '\u4e00' && c <= '\u9fa5');
    }

    /**
     * Join path segments with '/', the only separator the ZIP format recognises.
     *
     * @param relative Relative path, e.g. {@code photos\a.png} on Windows
     * @return entry name, e.g. "photos/a.png"
     * @throws IllegalArgumentException if path is absolute or empty
     */
    public static String fromRelativePath(Path relative) {
        if (relative.isAbsolute()) {
            throw new IllegalArgumentException("Entry path must be relative: " + relative);
        }
        StringBuilder name = new StringBuilder();
        for (Path segment : relative) {
            String part = segment.toString();
            if (part.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append('/');
            }
            name.append(part);
        }
        if (name.length() == 0) {
            throw new IllegalArgumentException("Entry path is empty");
        }
        return name.toString();
    }

    /**
     * Drop a trailing ".b64" or ".base64" (case-insensitive), so "cat.png.b64" becomes "cat.png".
     * Names without such a suffix, or consisting only of it, are returned unchanged.
     */
    public static String stripEncodingSuffix(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String suffix : ENCODING_SUFFIXES) {
            if (lower.endsWith(suffix) && lower.length() > suffix.length()) {
                return fileName.substring(0, fileName.length() - suffix.length());
            }
        }
        return fileName;
    }

    /**
     * File name without its last extension: "Top View.png" → "Top View".
     * A leading dot does not count as an extension separator.
     */
    public static String stem(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
