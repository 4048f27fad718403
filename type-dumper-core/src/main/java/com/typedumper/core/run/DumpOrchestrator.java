package com.typedumper.core.run;

import com.typedumper.core.analysis.BinaryAnalyzer;
import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.analysis.TypeModelBuilder;
import com.typedumper.core.dispatch.DispatchException;
import com.typedumper.core.dispatch.DumpOptions;
import com.typedumper.core.dispatch.LayoutDispatchEngine;
import com.typedumper.core.model.Toolchain;
import com.typedumper.core.model.TypeModel;
import com.typedumper.core.path.ArtifactPathPlanner;
import com.typedumper.core.path.UnsupportedPathException;
import com.typedumper.core.renderer.ScriptRenderer;
import com.typedumper.core.renderer.SourceRenderer;
import com.typedumper.core.util.FileUtils;
import com.typedumper.core.util.StageTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a complete dump of one binary and metadata pair.
 *
 * <p>Orchestrates the pipeline:
 * <ol>
 *   <li>Check that the binary, then the metadata file exist</li>
 *   <li>In solution mode, locate the toolchain (wildcard resolution and marker files)</li>
 *   <li>Analyze the input once to discover its images</li>
 *   <li>For every image in discovery order: build the type model, plan the output
 *       paths from the image index, write the source output, write the script</li>
 * </ol>
 *
 * <p>Every precondition failure stops the run before anything is written. Images are
 * processed strictly one after the other; when image {@code k} fails the run stops and
 * the artifacts of images {@code 0..k-1} stay on disk.
 */
public class DumpOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DumpOrchestrator.class);

    private final BinaryAnalyzer analyzer;
    private final SourceRenderer sourceRenderer;
    private final ScriptRenderer scriptRenderer;
    private final ToolchainLocator toolchainLocator;
    private final StageTimer timer;

    /**
     * Creates an orchestrator.
     *
     * @param analyzer analysis collaborator
     * @param sourceRenderer source text renderer
     * @param scriptRenderer script renderer
     * @param toolchainLocator toolchain locator used in solution mode
     * @param timer stage timer
     */
    public DumpOrchestrator(BinaryAnalyzer analyzer,
                            SourceRenderer sourceRenderer,
                            ScriptRenderer scriptRenderer,
                            ToolchainLocator toolchainLocator,
                            StageTimer timer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.sourceRenderer = Objects.requireNonNull(sourceRenderer, "sourceRenderer must not be null");
        this.scriptRenderer = Objects.requireNonNull(scriptRenderer, "scriptRenderer must not be null");
        this.toolchainLocator = Objects.requireNonNull(toolchainLocator, "toolchainLocator must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
    }

    /**
     * Dumps all images of an input pair.
     *
     * @param binaryFile native binary
     * @param metadataFile metadata file
     * @param options run options
     * @return run result with exit code and the images written
     */
    public RunResult run(Path binaryFile, Path metadataFile, DumpOptions options) {
        Objects.requireNonNull(binaryFile, "binaryFile must not be null");
        Objects.requireNonNull(metadataFile, "metadataFile must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (!FileUtils.isRegularFile(binaryFile)) {
            return inputNotFound(binaryFile.toString(), "File " + binaryFile + " does not exist");
        }
        if (!FileUtils.isRegularFile(metadataFile)) {
            return inputNotFound(metadataFile.toString(), "File " + metadataFile + " does not exist");
        }

        Toolchain toolchain = null;
        if (options.createSolution()) {
            try {
                toolchain = toolchainLocator.locate(options.toolchainRoot(), options.toolchainAssembliesRoot());
            } catch (ToolchainNotFoundException e) {
                return inputNotFound(e.getPath(), e.getMessage());
            } catch (UnsupportedPathException e) {
                return inputNotFound(e.getPath(), e.getMessage());
            }
        }

        List<BinaryImage> images;
        try {
            images = timer.measure("Analyze binary data",
                () -> analyzer.loadFromFile(binaryFile, metadataFile));
        } catch (IOException e) {
            log.error("Analysis of {} failed", metadataFile, e);
            return RunResult.failed(List.of(), FailureKind.ANALYSIS_FAILURE, metadataFile.toString(),
                "Failed to analyze " + metadataFile + ": " + e.getMessage());
        }
        if (images == null || images.isEmpty()) {
            log.error("Analyzer {} found no images in {}", analyzer.getId(), metadataFile);
            return RunResult.failed(List.of(), FailureKind.ANALYSIS_FAILURE, metadataFile.toString(),
                "No images found in " + binaryFile + " and " + metadataFile);
        }

        LayoutDispatchEngine engine = new LayoutDispatchEngine(toolchain);
        TypeModelBuilder modelBuilder = analyzer.modelBuilder();
        List<RunResult.ImageOutcome> completed = new ArrayList<>();

        for (int index = 0; index < images.size(); index++) {
            BinaryImage image = images.get(index);
            log.info("Processing image {} of {}: {}", index + 1, images.size(), image.name());

            TypeModel model = timer.measure("Create type model", () -> modelBuilder.buildModel(image));
            if (model == null) {
                return RunResult.failed(completed, FailureKind.ANALYSIS_FAILURE, image.name(),
                    "No type model could be built for image " + image.name());
            }

            String sourcePath = ArtifactPathPlanner.planPath(options.outputBasePath(), index);
            String scriptPath = ArtifactPathPlanner.planPath(options.scriptOutputPath(), index);

            try {
                timer.run("Generate C# code",
                    () -> engine.dispatch(image, model, options, sourcePath, sourceRenderer));
            } catch (DispatchException e) {
                log.error("Source output of image {} failed: {}", image.name(), e.getMessage());
                FailureKind kind = e.getReason() == DispatchException.Reason.UNSUPPORTED_COMBINATION
                    ? FailureKind.UNSUPPORTED_COMBINATION
                    : FailureKind.RENDER_FAILURE;
                return RunResult.failed(completed, kind, image.name(), e.getMessage());
            }

            try {
                timer.run("Generate IDA Python script",
                    () -> scriptRenderer.writeScriptToFile(model, Paths.get(scriptPath)));
            } catch (IOException | UncheckedIOException e) {
                log.error("Script output of image {} failed: {}", image.name(), e.getMessage());
                return RunResult.failed(completed, FailureKind.RENDER_FAILURE, image.name(),
                    "Failed to write script of image " + image.name() + " to " + scriptPath + ": " + e.getMessage());
            }

            completed.add(new RunResult.ImageOutcome(index, image.name(), sourcePath, scriptPath));
        }

        log.info("Dumped {} images", completed.size());
        return RunResult.succeeded(completed);
    }

    private static RunResult inputNotFound(String path, String message) {
        log.error(message);
        return RunResult.failed(List.of(), FailureKind.INPUT_NOT_FOUND, path, message);
    }
}
