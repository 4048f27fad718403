package com.typedumper.core.renderer.impl;

import com.typedumper.core.renderer.GeneratedFile;
import com.typedumper.core.renderer.GeneratedOutput;
import com.typedumper.core.renderer.OutputRenderer;
import com.typedumper.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes generated artifacts to the filesystem.
 *
 * <p>Creates the directory structure automatically and overwrites existing files.
 * Files are written in order; a failure leaves the files written before it in place.
 * A relative path that leaves the output directory is rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("Game/Player.cs", "...", GeneratedFile.CSHARP)
 * ));
 * new FileSystemRenderer().render(output, new RenderContext(Path.of("out"), "GameAssembly"));
 * // Creates: out/Game/Player.cs
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.debug("Rendering {} files for image {} at: {}",
            output.files().size(), context.imageName(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }

        logger.info("Wrote {} files ({} characters) to {}",
            output.files().size(), output.totalLength(), outputDir);
    }

    /**
     * Writes a single file to the filesystem.
     *
     * @param outputDir base output directory
     * @param file file to write
     */
    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        if (!targetPath.toAbsolutePath().normalize().startsWith(outputDir.toAbsolutePath().normalize())) {
            throw new UncheckedIOException(new IOException(
                "Refusing to write " + file.relativePath() + " outside of " + outputDir));
        }
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + targetPath, e);
        }
    }
}
