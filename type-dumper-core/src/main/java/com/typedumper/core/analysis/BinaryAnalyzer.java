package com.typedumper.core.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Discovers the images contained in a binary and its metadata file.
 *
 * <p>Analyzers are discovered via Java Service Provider Interface (SPI). Register
 * implementations in
 * {@code META-INF/services/com.typedumper.core.analysis.BinaryAnalyzer}.
 *
 * @see TypeModelBuilder
 */
public interface BinaryAnalyzer {

    /**
     * Returns unique identifier for this analyzer (e.g. "manifest").
     *
     * @return analyzer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this analyzer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Analyzes an input pair.
     *
     * @param binaryFile native binary
     * @param metadataFile metadata file
     * @return images in discovery order, or null if the input could not be analyzed
     * @throws IOException if the input cannot be read
     */
    List<BinaryImage> loadFromFile(Path binaryFile, Path metadataFile) throws IOException;

    /**
     * Returns the builder that turns images of this analyzer into type models.
     *
     * @return model builder
     */
    TypeModelBuilder modelBuilder();
}
