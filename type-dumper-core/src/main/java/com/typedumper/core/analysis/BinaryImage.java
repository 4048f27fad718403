package com.typedumper.core.analysis;

/**
 * One analyzable module discovered inside a binary and metadata input pair.
 *
 * <p>Images are opaque outside the analyzer that produced them; only the name is
 * used for diagnostics.
 */
public interface BinaryImage {

    /**
     * Returns a display name for the image.
     *
     * @return image name
     */
    String name();
}
