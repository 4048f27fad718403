package com.typedumper.core.dispatch;

import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.model.NamespaceFilter;
import com.typedumper.core.model.Toolchain;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;
import com.typedumper.core.renderer.RenderSettings;
import com.typedumper.core.renderer.SourceRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Objects;

/**
 * Selects and runs the source rendering strategy of one image.
 *
 * <p>The strategy follows from the effective layout and sort order of the
 * {@link DumpOptions}:
 * <table>
 *   <caption>Strategies</caption>
 *   <tr><th>Layout</th><th>Sort</th><th>Renderer call</th></tr>
 *   <tr><td>SINGLE</td><td>INDEX / NAME</td><td>{@link SourceRenderer#writeSingleFile}</td></tr>
 *   <tr><td>NAMESPACE</td><td>INDEX / NAME</td><td>{@link SourceRenderer#writeFilesByNamespace}</td></tr>
 *   <tr><td>ASSEMBLY</td><td>INDEX / NAME</td><td>{@link SourceRenderer#writeFilesByAssembly}</td></tr>
 *   <tr><td>CLASS</td><td>ignored</td><td>{@link SourceRenderer#writeFilesByClass}</td></tr>
 *   <tr><td>TREE</td><td>ignored</td><td>{@link SourceRenderer#writeFilesByClassTree}</td></tr>
 *   <tr><td>solution mode</td><td>ignored</td><td>{@link SourceRenderer#writeSolution}</td></tr>
 * </table>
 *
 * <p>Types in excluded namespaces are removed from the model before any strategy runs,
 * so every layout sees the same set of types. A missing layout, a missing sort order
 * for an ordered layout, or solution mode without a resolved toolchain fails with
 * {@link DispatchException.Reason#UNSUPPORTED_COMBINATION}; nothing is written then.
 */
public class LayoutDispatchEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutDispatchEngine.class);

    private final Toolchain toolchain;

    /**
     * Creates an engine for runs without solution mode.
     */
    public LayoutDispatchEngine() {
        this(null);
    }

    /**
     * Creates an engine.
     *
     * @param toolchain resolved toolchain for solution mode, or null if not resolved
     */
    public LayoutDispatchEngine(Toolchain toolchain) {
        this.toolchain = toolchain;
    }

    /**
     * Renders the source output of one image.
     *
     * @param image image being dumped
     * @param model type model of the image
     * @param options run options
     * @param artifactPath planned output path of this image
     * @param renderer source renderer
     * @throws DispatchException if the combination is unsupported or rendering fails
     */
    public void dispatch(BinaryImage image, TypeModel model, DumpOptions options, String artifactPath,
                         SourceRenderer renderer) throws DispatchException {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(artifactPath, "artifactPath must not be null");
        Objects.requireNonNull(renderer, "renderer must not be null");

        RenderStep step = select(model, options, Paths.get(artifactPath), renderer);

        log.info("Writing {} layout of image {} to {}",
            options.createSolution() ? "solution" : options.effectiveLayoutSchema().id(),
            image.name(), artifactPath);
        try {
            step.render();
        } catch (IOException | UncheckedIOException e) {
            throw new DispatchException(DispatchException.Reason.RENDER_FAILURE,
                "Failed to write source output of image " + image.name() + " to " + artifactPath + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Maps the effective options to exactly one renderer call.
     */
    private RenderStep select(TypeModel model, DumpOptions options, Path out, SourceRenderer renderer)
            throws DispatchException {
        LayoutSchema layout = options.effectiveLayoutSchema();
        SortOrder sort = options.sortOrder();
        if (layout == null) {
            throw DispatchException.unsupported(null, sort, "no layout given");
        }

        TypeModel visible = new NamespaceFilter(options.excludedNamespaces()).apply(model);
        RenderSettings settings = new RenderSettings(
            options.excludedNamespaces(),
            options.suppressMetadata(),
            options.effectiveMustCompile());
        boolean separate = options.effectiveSeparateAssemblyAttributesFiles();
        boolean flatten = options.flattenHierarchy();

        if (options.createSolution()) {
            if (toolchain == null) {
                throw DispatchException.unsupported(layout, sort, "solution mode requires a resolved toolchain");
            }
            return () -> renderer.writeSolution(visible, settings, out, toolchain);
        }

        Comparator<TypeEntry> order = layout.isOrdered() ? orderFor(layout, sort) : null;

        return switch (layout) {
            case SINGLE -> () -> renderer.writeSingleFile(visible, settings, out, order);
            case NAMESPACE -> () -> renderer.writeFilesByNamespace(visible, settings, out, order, flatten);
            case ASSEMBLY -> () -> renderer.writeFilesByAssembly(visible, settings, out, order, separate);
            case CLASS -> () -> renderer.writeFilesByClass(visible, settings, out, flatten);
            case TREE -> () -> renderer.writeFilesByClassTree(visible, settings, out, separate);
        };
    }

    private static Comparator<TypeEntry> orderFor(LayoutSchema layout, SortOrder sort) throws DispatchException {
        if (sort == null) {
            throw DispatchException.unsupported(layout, null, "layout " + layout.id() + " needs a sort order");
        }
        return sort.comparator();
    }

    @FunctionalInterface
    private interface RenderStep {
        void render() throws IOException;
    }
}
