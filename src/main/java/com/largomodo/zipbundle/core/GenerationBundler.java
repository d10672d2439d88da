package com.largomodo.zipbundle.core;

import com.largomodo.zipbundle.core.domain.Archive;
import com.largomodo.zipbundle.core.domain.BundleFile;
import com.largomodo.zipbundle.core.domain.GeneratedImage;
import com.largomodo.zipbundle.service.ArchiveWriter;
import com.largomodo.zipbundle.util.EntryNames;

import java.util.List;

/**
 * Packs one generation result (source image plus generated perspectives) into a downloadable bundle.
 * <p>
 * Bundle layout:
 * <pre>
 * ai-generated-&lt;id&gt;.zip
 *   original.png
 *   1_&lt;perspective&gt;.png
 *   2_&lt;perspective&gt;.png
 *   ...
 * </pre>
 * Perspective names are sanitized with {@link EntryNames#sanitizeLabel(String)}; numbering is
 * 1-based and follows list order, which keeps names unique even when labels collide.
 */
public class GenerationBundler {

    public static final String ORIGINAL_ENTRY = "original.png";
    private static final String BUNDLE_PREFIX = "ai-generated-";
    private static final String BUNDLE_SUFFIX = ".zip";
    private static final String IMAGE_SUFFIX = ".png";

    private final ArchiveWriter writer;

    public GenerationBundler(ArchiveWriter writer) {
        this.writer = writer;
    }

    /**
     * Download name for a result: "ai-generated-&lt;resultId&gt;.zip".
     *
     * @throws IllegalArgumentException if resultId is null or blank
     */
    public static String fileNameFor(String resultId) {
        if (resultId == null || resultId.isBlank()) {
            throw new IllegalArgumentException("resultId must not be null or blank");
        }
        return BUNDLE_PREFIX + resultId + BUNDLE_SUFFIX;
    }

    /**
     * Entry name of the generated image at 0-based list position {@code index}.
     */
    public static String entryNameFor(int index, GeneratedImage image) {
        return (index + 1) + "_" + EntryNames.sanitizeLabel(image.perspectiveName()) + IMAGE_SUFFIX;
    }

    /**
     * Lay out the bundle entries without assembling them.
     */
    public Archive toArchive(byte[] original, List<GeneratedImage> images) {
        Archive archive = new Archive();
        archive.addEntry(ORIGINAL_ENTRY, original);
        for (int i = 0; i < images.size(); i++) {
            GeneratedImage image = images.get(i);
            archive.addEntry(entryNameFor(i, image), image.image());
        }
        return archive;
    }

    /**
     * Assemble the complete bundle for one result.
     *
     * @param resultId Identifier of the generation result, used in the file name
     * @param original Source image bytes
     * @param images   Generated views in display order
     * @return file name and archive bytes
     */
    public BundleFile bundle(String resultId, byte[] original, List<GeneratedImage> images) {
        String fileName = fileNameFor(resultId);
        byte[] content = writer.assemble(toArchive(original, images));
        return new BundleFile(fileName, content);
    }
}
