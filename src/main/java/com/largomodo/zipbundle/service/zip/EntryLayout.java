package com.largomodo.zipbundle.service.zip;

/**
 * Everything the local and central encoders need for one entry, fixed during the layout pass.
 *
 * @param encodedName       UTF-8 name bytes
 * @param flags             General purpose bit flag
 * @param method            Compression method id
 * @param dosTime           Packed DOS modification time
 * @param dosDate           Packed DOS modification date
 * @param crc32             CRC-32 of the uncompressed payload
 * @param uncompressedSize  Payload length before encoding
 * @param data              Bytes written after the local header
 * @param localHeaderOffset Absolute position of the local header in the archive
 */
record EntryLayout(byte[] encodedName,
                   int flags,
                   int method,
                   int dosTime,
                   int dosDate,
                   long crc32,
                   long uncompressedSize,
                   byte[] data,
                   long localHeaderOffset) {

    long compressedSize() {
        return data.length;
    }

    /** Local header plus stored data. */
    long localRecordLength() {
        return (long) ZipConstants.LOCAL_HEADER_SIZE + encodedName.length + data.length;
    }

    long centralRecordLength() {
        return (long) ZipConstants.CENTRAL_HEADER_SIZE + encodedName.length;
    }
}
