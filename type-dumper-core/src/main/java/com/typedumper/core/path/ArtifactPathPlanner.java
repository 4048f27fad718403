package com.typedumper.core.path;

import com.typedumper.core.util.FileUtils;

import java.util.Objects;

/**
 * Derives per-image output paths from a configured base path.
 *
 * <p>The first image writes to the base path itself. Image {@code k > 0} gets a
 * {@code -k} suffix, placed before the extension of the final path segment when it
 * has one:
 * <pre>
 * types.cs,   0  -&gt;  types.cs
 * types.cs,   1  -&gt;  types-1.cs
 * out/cs,     2  -&gt;  out/cs-2
 * </pre>
 * Distinct indexes always yield distinct paths for the same base path.
 */
public final class ArtifactPathPlanner {

    private ArtifactPathPlanner() {
        // Utility class
    }

    /**
     * Plans the output path of one image.
     *
     * @param basePath configured output path
     * @param imageIndex zero-based discovery index of the image
     * @return output path for the image
     * @throws IllegalArgumentException if imageIndex is negative
     */
    public static String planPath(String basePath, int imageIndex) {
        Objects.requireNonNull(basePath, "basePath must not be null");
        if (imageIndex < 0) {
            throw new IllegalArgumentException("imageIndex must not be negative: " + imageIndex);
        }
        if (imageIndex == 0) {
            return basePath;
        }

        String suffix = "-" + imageIndex;
        int dot = FileUtils.extensionDotIndex(basePath);
        if (dot < 0) {
            return basePath + suffix;
        }
        return basePath.substring(0, dot) + suffix + basePath.substring(dot);
    }
}
