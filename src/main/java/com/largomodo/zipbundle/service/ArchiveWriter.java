package com.largomodo.zipbundle.service;

import com.largomodo.zipbundle.core.domain.Archive;

/**
 * Service interface for turning an {@link Archive} into a single archive buffer.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Entries appear in the output in insertion order</li>
 *   <li>The archive is only read; it is not modified</li>
 *   <li>Each call returns a new buffer; no state is retained between calls</li>
 *   <li>On failure nothing is returned: no partial or truncated buffer escapes</li>
 * </ul>
 * <p>
 * Implementations must be safe to call concurrently for independent archives.
 */
public interface ArchiveWriter {

    /**
     * Assemble all entries into one complete archive.
     *
     * @param archive Entries to bundle
     * @return complete archive bytes
     * @throws com.largomodo.zipbundle.core.SizeLimitExceededException if a name, count, offset or size
     *                                                                  does not fit the format
     * @throws com.largomodo.zipbundle.core.EmptyArchiveException      if the archive is empty and the
     *                                                                  configured policy rejects that
     */
    byte[] assemble(Archive archive);
}
