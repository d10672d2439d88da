package com.largomodo.zipbundle.core.domain;

import java.util.Arrays;

/**
 * One generated view of a product image, labelled with the perspective it was rendered from.
 *
 * @param perspectiveName Human readable label, e.g. "Top View" or "侧面"
 * @param image           Decoded image bytes
 */
public record GeneratedImage(String perspectiveName, byte[] image) {

    public GeneratedImage {
        if (perspectiveName == null || perspectiveName.isBlank()) {
            throw new IllegalArgumentException("perspectiveName must not be null or blank");
        }
        if (image == null) {
            throw new IllegalArgumentException("image must not be null: " + perspectiveName);
        }
        image = image.clone();
    }

    @Override
    public byte[] image() {
        return image.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeneratedImage other)) return false;
        return perspectiveName.equals(other.perspectiveName) && Arrays.equals(image, other.image);
    }

    @Override
    public int hashCode() {
        return 31 * perspectiveName.hashCode() + Arrays.hashCode(image);
    }

    @Override
    public String toString() {
        return "GeneratedImage[perspectiveName=" + perspectiveName + ", size=" + image.length + "]";
    }
}
