package com.typedumper.core.renderer;

import java.util.Objects;

/**
 * A text artifact produced for one image, ready to be written.
 *
 * @param relativePath path relative to the render output directory (e.g. "Game/Player.cs")
 * @param content file content
 * @param contentType content type of the artifact
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String CSHARP = "text/x-csharp";
    public static final String PYTHON = "text/x-python";
    public static final String MSBUILD = "application/xml";
    public static final String SOLUTION = "text/plain";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
