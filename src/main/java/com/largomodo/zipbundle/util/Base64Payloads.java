package com.largomodo.zipbundle.util;

import com.largomodo.zipbundle.core.InvalidEntryException;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decoding of payloads that arrive as base64 text, either bare or wrapped in a data URL
 * ({@code data:image/png;base64,iVBORw0...}).
 * <p>
 * Image generation back ends hand results over in this form; archives need the raw bytes.
 */
public class Base64Payloads {

    private static final Pattern DATA_URL_PREFIX = Pattern.compile("^data:[^,;]*(;[^,;]+)*;base64,");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Base64Payloads() {
        // Static utility class - prevent instantiation
    }

    /**
     * Decode base64 text into raw bytes.
     * <p>
     * A data URL prefix is removed first. Whitespace anywhere in the text (line-wrapped
     * exports, trailing newlines) is ignored.
     *
     * @param text Base64 text or data URL
     * @return decoded bytes
     * @throws InvalidEntryException if text is null or not valid base64
     */
    public static byte[] decode(String text) {
        if (text == null) {
            throw new InvalidEntryException("Base64 payload must not be null");
        }
        String body = text.stripLeading();
        Matcher prefix = DATA_URL_PREFIX.matcher(body);
        if (prefix.find()) {
            body = body.substring(prefix.end());
        }
        body = WHITESPACE.matcher(body).replaceAll("");

        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new InvalidEntryException("Payload is not valid base64: " + e.getMessage(), e);
        }
    }
}
