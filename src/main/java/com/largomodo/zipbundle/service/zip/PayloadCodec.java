package com.largomodo.zipbundle.service.zip;

/**
 * Per-entry payload transformation, paired with the compression method id that
 * describes it in local and central records.
 */
public interface PayloadCodec {

    /**
     * @return value for the 2-byte compression method field
     */
    int method();

    /**
     * Transform the payload into the bytes stored after the local header.
     *
     * @param payload Uncompressed entry bytes
     * @return stored bytes; their length is written as the compressed size
     */
    byte[] encode(byte[] payload);
}
