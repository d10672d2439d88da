package com.largomodo.zipbundle.service.zip;

/**
 * Method 0 (store): payload bytes are written verbatim.
 */
public class StoredPayloadCodec implements PayloadCodec {

    @Override
    public int method() {
        return ZipConstants.METHOD_STORED;
    }

    @Override
    public byte[] encode(byte[] payload) {
        return payload;
    }
}
