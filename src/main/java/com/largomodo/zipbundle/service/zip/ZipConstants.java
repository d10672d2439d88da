package com.largomodo.zipbundle.service.zip;

/**
 * Signatures, field values and record sizes of the classic ZIP layout (APPNOTE 6.3, sections 4.3.7,
 * 4.3.12 and 4.3.16).
 */
final class ZipConstants {

    static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;
    static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
    static final int END_OF_CENTRAL_DIRECTORY_SIGNATURE = 0x06054b50;

    // Fixed parts, name bytes follow
    static final int LOCAL_HEADER_SIZE = 30;
    static final int CENTRAL_HEADER_SIZE = 46;
    static final int END_OF_CENTRAL_DIRECTORY_SIZE = 22;

    /** PKZIP 2.0: stored and deflated entries, directories. */
    static final int VERSION_NEEDED_TO_EXTRACT = 20;
    /** Upper byte 0 (MS-DOS host), lower byte 20 (APPNOTE 2.0). */
    static final int VERSION_MADE_BY = 20;

    static final int METHOD_STORED = 0;

    /** General purpose bit 11: name and comment are UTF-8. */
    static final int FLAG_UTF8 = 1 << 11;

    static final int MAX_UINT16 = 0xFFFF;
    static final long MAX_UINT32 = 0xFFFFFFFFL;

    /** Largest byte array most JVMs will allocate. */
    static final long MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

    private ZipConstants() {
    }
}
