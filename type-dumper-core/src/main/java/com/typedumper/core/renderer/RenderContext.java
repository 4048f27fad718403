package com.typedumper.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Target of an {@link OutputRenderer} call.
 *
 * @param outputDirectory directory that relative artifact paths are resolved against
 * @param imageName image the artifacts belong to, used for diagnostics
 */
public record RenderContext(
    Path outputDirectory,
    String imageName
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (imageName == null) {
            imageName = "";
        }
    }
}
