package com.typedumper.core.renderer;

import com.typedumper.core.model.Toolchain;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;

/**
 * Produces source text artifacts for a type model, one operation per file layout.
 *
 * <p>Every operation honours {@link RenderSettings}: types in excluded namespaces are
 * never written, {@code suppressMetadata} drops indices, offsets and addresses from the
 * text, and {@code mustCompile} drops compiler-generated items.
 *
 * <p>Operations taking an {@code order} sort the types inside each artifact with it.
 * Per-type layouts need no order since every type gets its own file.
 */
public interface SourceRenderer {

    /**
     * Writes all types into one file.
     *
     * @param model type model
     * @param settings render switches
     * @param outputFile file to write
     * @param order type order within the file
     * @throws IOException if writing fails
     */
    void writeSingleFile(TypeModel model, RenderSettings settings, Path outputFile,
                         Comparator<TypeEntry> order) throws IOException;

    /**
     * Writes one file per namespace.
     *
     * @param model type model
     * @param settings render switches
     * @param outputDirectory root directory
     * @param order type order within each file
     * @param flatten name files after the full namespace instead of nesting directories
     * @throws IOException if writing fails
     */
    void writeFilesByNamespace(TypeModel model, RenderSettings settings, Path outputDirectory,
                               Comparator<TypeEntry> order, boolean flatten) throws IOException;

    /**
     * Writes one file per assembly.
     *
     * @param model type model
     * @param settings render switches
     * @param outputDirectory root directory
     * @param order type order within each file
     * @param separateAttributes write assembly-level attributes to their own files
     * @throws IOException if writing fails
     */
    void writeFilesByAssembly(TypeModel model, RenderSettings settings, Path outputDirectory,
                              Comparator<TypeEntry> order, boolean separateAttributes) throws IOException;

    /**
     * Writes one file per type inside namespace directories.
     *
     * @param model type model
     * @param settings render switches
     * @param outputDirectory root directory
     * @param flatten put all files in the root directory, prefixed with their namespace
     * @throws IOException if writing fails
     */
    void writeFilesByClass(TypeModel model, RenderSettings settings, Path outputDirectory,
                           boolean flatten) throws IOException;

    /**
     * Writes one file per type inside assembly, then namespace directories.
     *
     * @param model type model
     * @param settings render switches
     * @param outputDirectory root directory
     * @param separateAttributes write assembly-level attributes to {@code Properties/AssemblyInfo.cs}
     * @throws IOException if writing fails
     */
    void writeFilesByClassTree(TypeModel model, RenderSettings settings, Path outputDirectory,
                               boolean separateAttributes) throws IOException;

    /**
     * Writes the class tree plus a solution file and one project per assembly,
     * referencing the toolchain assemblies.
     *
     * @param model type model
     * @param settings render switches
     * @param outputDirectory root directory
     * @param toolchain resolved toolchain installation
     * @throws IOException if writing fails
     */
    void writeSolution(TypeModel model, RenderSettings settings, Path outputDirectory,
                       Toolchain toolchain) throws IOException;
}
