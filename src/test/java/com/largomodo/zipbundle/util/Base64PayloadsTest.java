package com.largomodo.zipbundle.util;

import com.largomodo.zipbundle.core.InvalidEntryException;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class Base64PayloadsTest {

    @Test
    void decodesBareBase64() {
        assertArrayEquals("hello".getBytes(StandardCharsets.US_ASCII), Base64Payloads.decode("aGVsbG8="));
    }

    @Test
    void stripsDataUrlPrefix() {
        String dataUrl = "data:image/png;base64,iVBORw0KGgo=";

        assertArrayEquals(new byte[]{(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'},
                Base64Payloads.decode(dataUrl));
    }

    @Test
    void acceptsDataUrlWithParameters() {
        String dataUrl = "data:text/plain;charset=utf-8;base64,aGVsbG8=";

        assertArrayEquals("hello".getBytes(StandardCharsets.US_ASCII), Base64Payloads.decode(dataUrl));
    }

    @Test
    void ignoresWhitespaceAndLineBreaks() {
        assertArrayEquals("hello world".getBytes(StandardCharsets.US_ASCII),
                Base64Payloads.decode("  aGVsbG8g\r\nd29y\nbGQ=\n"));
    }

    @Test
    void nonBase64DataUrlIsRejected() {
        assertThrows(InvalidEntryException.class, () -> Base64Payloads.decode("data:image/png,raw"),
                "Only base64 data URLs are unwrapped");
    }

    @Test
    void emptyTextDecodesToEmptyPayload() {
        assertEquals(0, Base64Payloads.decode("").length);
        assertEquals(0, Base64Payloads.decode("data:image/png;base64,").length);
    }

    @Test
    void malformedInputRejected() {
        InvalidEntryException e = assertThrows(InvalidEntryException.class, () -> Base64Payloads.decode("not*base64"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertThrows(InvalidEntryException.class, () -> Base64Payloads.decode(null));
    }

    @Property
    void decodeInvertsStandardEncoding(@ForAll byte[] payload) {
        String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(payload);

        assertArrayEquals(payload, Base64Payloads.decode(dataUrl));
    }
}
