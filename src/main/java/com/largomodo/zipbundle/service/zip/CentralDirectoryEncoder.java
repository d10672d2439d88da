package com.largomodo.zipbundle.service.zip;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Serializes the central directory file header of one entry.
 * <p>
 * Mirrors the local header fields and adds the attributes and the offset of the local header,
 * which lets readers locate every entry without scanning the whole archive.
 * <pre>
 *  0  4  signature 0x02014b50
 *  4  2  version made by
 *  6  2  version needed to extract
 *  8  2  general purpose flag
 * 10  2  compression method
 * 12  2  last mod time
 * 14  2  last mod date
 * 16  4  crc-32
 * 20  4  compressed size
 * 24  4  uncompressed size
 * 28  2  file name length
 * 30  2  extra field length
 * 32  2  file comment length
 * 34  2  disk number start
 * 36  2  internal file attributes
 * 38  4  external file attributes
 * 42  4  relative offset of local header
 * 46  n  file name
 * </pre>
 */
class CentralDirectoryEncoder {

    byte[] encode(EntryLayout entry) {
        ByteBuffer buffer = ByteBuffer.allocate((int) entry.centralRecordLength());
        buffer.order(ByteOrder.LITTLE_ENDIAN);

        buffer.putInt(ZipConstants.CENTRAL_HEADER_SIGNATURE);
        buffer.putShort((short) ZipConstants.VERSION_MADE_BY);
        buffer.putShort((short) ZipConstants.VERSION_NEEDED_TO_EXTRACT);
        buffer.putShort((short) entry.flags());
        buffer.putShort((short) entry.method());
        buffer.putShort((short) entry.dosTime());
        buffer.putShort((short) entry.dosDate());
        buffer.putInt((int) entry.crc32());
        buffer.putInt((int) entry.compressedSize());
        buffer.putInt((int) entry.uncompressedSize());
        buffer.putShort((short) entry.encodedName().length);
        buffer.putShort((short) 0); // Extra field length
        buffer.putShort((short) 0); // Comment length
        buffer.putShort((short) 0); // Disk number start
        buffer.putShort((short) 0); // Internal attributes
        buffer.putInt(0);           // External attributes
        buffer.putInt((int) entry.localHeaderOffset());
        buffer.put(entry.encodedName());

        return buffer.array();
    }
}
