package com.typedumper.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Set of artifacts written together by one renderer call.
 *
 * @param files generated files in write order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns the total number of characters across all files.
     *
     * @return content length sum
     */
    public long totalLength() {
        return files.stream().mapToLong(f -> f.content().length()).sum();
    }
}
