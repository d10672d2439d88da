package com.largomodo.zipbundle.service.zip;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Serializes the local file header of one entry, immediately followed by its stored data.
 * <p>
 * Layout (all little-endian):
 * <pre>
 *  0  4  signature 0x04034b50
 *  4  2  version needed to extract
 *  6  2  general purpose flag
 *  8  2  compression method
 * 10  2  last mod time
 * 12  2  last mod date
 * 14  4  crc-32
 * 18  4  compressed size
 * 22  4  uncompressed size
 * 26  2  file name length
 * 28  2  extra field length
 * 30  n  file name
 *     m  data
 * </pre>
 */
class LocalFileHeaderEncoder {

    byte[] encode(EntryLayout entry) {
        ByteBuffer buffer = ByteBuffer.allocate((int) entry.localRecordLength());
        buffer.order(ByteOrder.LITTLE_ENDIAN);

        buffer.putInt(ZipConstants.LOCAL_HEADER_SIGNATURE);
        buffer.putShort((short) ZipConstants.VERSION_NEEDED_TO_EXTRACT);
        buffer.putShort((short) entry.flags());
        buffer.putShort((short) entry.method());
        buffer.putShort((short) entry.dosTime());
        buffer.putShort((short) entry.dosDate());
        buffer.putInt((int) entry.crc32());
        buffer.putInt((int) entry.compressedSize());
        buffer.putInt((int) entry.uncompressedSize());
        buffer.putShort((short) entry.encodedName().length);
        buffer.putShort((short) 0); // No extra field
        buffer.put(entry.encodedName());
        buffer.put(entry.data());

        return buffer.array();
    }
}
