package com.typedumper.core.model;

import java.util.Objects;

/**
 * Resolved location of the local toolchain installation referenced by generated
 * project files.
 *
 * @param editorPath resolved toolchain (editor) root directory
 * @param assembliesPath resolved directory holding the toolchain script assemblies
 */
public record Toolchain(
    String editorPath,
    String assembliesPath
) {
    /**
     * Compact constructor with validation.
     */
    public Toolchain {
        Objects.requireNonNull(editorPath, "editorPath must not be null");
        Objects.requireNonNull(assembliesPath, "assembliesPath must not be null");
    }
}
