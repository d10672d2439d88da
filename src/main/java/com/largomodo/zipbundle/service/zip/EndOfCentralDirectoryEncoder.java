package com.largomodo.zipbundle.service.zip;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Serializes the fixed 22-byte end of central directory record. Single disk, no comment.
 */
class EndOfCentralDirectoryEncoder {

    /**
     * @param entryCount       Number of central directory records
     * @param directorySize    Total length of all central directory records in bytes
     * @param directoryOffset  Absolute position of the first central directory record
     */
    byte[] encode(int entryCount, long directorySize, long directoryOffset) {
        ByteBuffer buffer = ByteBuffer.allocate(ZipConstants.END_OF_CENTRAL_DIRECTORY_SIZE);
        buffer.order(ByteOrder.LITTLE_ENDIAN);

        buffer.putInt(ZipConstants.END_OF_CENTRAL_DIRECTORY_SIGNATURE);
        buffer.putShort((short) 0); // Number of this disk
        buffer.putShort((short) 0); // Disk where central directory starts
        buffer.putShort((short) entryCount);
        buffer.putShort((short) entryCount);
        buffer.putInt((int) directorySize);
        buffer.putInt((int) directoryOffset);
        buffer.putShort((short) 0); // Comment length

        return buffer.array();
    }
}
