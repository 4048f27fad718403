package com.typedumper.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typedumper.core.analysis.BinaryAnalyzer;
import com.typedumper.core.config.ConfigLoader;
import com.typedumper.core.config.DumperConfig;
import com.typedumper.core.dispatch.DumpOptions;
import com.typedumper.core.dispatch.LayoutSchema;
import com.typedumper.core.dispatch.SortOrder;
import com.typedumper.core.path.WildcardPathResolver;
import com.typedumper.core.renderer.OutputRenderer;
import com.typedumper.core.renderer.impl.CSharpSourceRenderer;
import com.typedumper.core.renderer.impl.IdaPythonScriptRenderer;
import com.typedumper.core.run.DumpOrchestrator;
import com.typedumper.core.run.RunResult;
import com.typedumper.core.run.ToolchainLocator;
import com.typedumper.core.util.StageTimer;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to dump the types of a binary and metadata pair.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load {@code typedumper.yaml} and merge the command-line options over it</li>
 *   <li>Discover the analyzer and the output renderer via SPI</li>
 *   <li>Write the C# source output and the IDA Python script of every image</li>
 * </ol>
 *
 * <p>When a binary contains several images, the second and later images get a
 * {@code -1}, {@code -2}, ... suffix before the file extension of both output paths.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Dump with defaults (libil2cpp.so + global-metadata.dat into types.cs and ida.py)
 * typedumper dump
 *
 * # One file per class, flattened, without metadata comments
 * typedumper dump -l class -f -n -c out/
 *
 * # Keep every namespace
 * typedumper dump -e none
 * }</pre>
 */
@Command(
    name = "dump",
    description = "Dump type declarations and method symbols of a binary",
    mixinStandardHelpOptions = true
)
public class DumpCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DumpCommand.class);

    /** Value of {@code --exclude-namespaces} that keeps every namespace. */
    static final String NO_EXCLUSIONS = "none";

    /** Analyzer used unless {@code --analyzer} names another one. */
    static final String DEFAULT_ANALYZER = "manifest";

    /** Output renderer used unless {@code --renderer} names another one. */
    static final String DEFAULT_RENDERER = "filesystem";

    @Option(names = {"-i", "--bin"}, description = "Binary file (default: ${DEFAULT-VALUE})",
        defaultValue = "libil2cpp.so")
    private Path binaryFile;

    @Option(names = {"-m", "--metadata"}, description = "Metadata file (default: ${DEFAULT-VALUE})",
        defaultValue = "global-metadata.dat")
    private Path metadataFile;

    @Option(names = {"-c", "--cs-out"},
        description = "C# output file or directory, depending on the layout (default: types.cs)")
    private String sourceOutput;

    @Option(names = {"-p", "--py-out"}, description = "IDA Python script output file (default: ida.py)")
    private String scriptOutput;

    @Option(names = {"-e", "--exclude-namespaces"}, split = ",",
        description = "Comma-separated namespaces to leave out, or 'none' to keep all")
    private List<String> excludedNamespaces;

    @Option(names = {"-l", "--layout"}, description = "Output layout: single, namespace, assembly, class, tree")
    private String layout;

    @Option(names = {"-s", "--sort"}, description = "Type order for ordered layouts: index, name")
    private String sort;

    @Option(names = {"-f", "--flatten"}, description = "Use flat file names instead of namespace directories")
    private boolean flatten;

    @Option(names = {"-n", "--suppress-metadata"}, description = "Leave out offsets, addresses and type indices")
    private boolean suppressMetadata;

    @Option(names = {"-k", "--must-compile"}, description = "Leave out compiler-generated types and members")
    private boolean mustCompile;

    @Option(names = {"--separate-attributes"}, description = "Write assembly attributes into separate files")
    private boolean separateAttributes;

    @Option(names = {"-j", "--project"},
        description = "Write a buildable solution (implies tree layout, --must-compile and --separate-attributes)")
    private boolean createSolution;

    @Option(names = {"--unity-path"}, description = "Toolchain installation path, may contain wildcards")
    private String toolchainRoot;

    @Option(names = {"--unity-assemblies"}, description = "Toolchain assemblies path, may contain wildcards")
    private String toolchainAssembliesRoot;

    @Option(names = {"--analyzer"}, description = "Analyzer ID (default: ${DEFAULT-VALUE})",
        defaultValue = DEFAULT_ANALYZER)
    private String analyzerId;

    @Option(names = {"--renderer"}, description = "Output renderer ID (default: ${DEFAULT-VALUE})",
        defaultValue = DEFAULT_RENDERER)
    private String rendererId;

    @Option(names = {"--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configPath;

    @Override
    public Integer call() {
        try {
            DumperConfig config = ConfigLoader.load(configPath);

            DumpOptions options;
            try {
                options = buildOptions(config);
            } catch (IllegalArgumentException e) {
                log.error("Invalid options: {}", e.getMessage());
                System.err.println("✗ " + e.getMessage());
                return RunResult.EXIT_FAILURE;
            }

            Optional<BinaryAnalyzer> analyzer = findAnalyzer(analyzerId);
            if (analyzer.isEmpty()) {
                log.error("Unknown analyzer: {}", analyzerId);
                System.err.println("✗ Unknown analyzer: " + analyzerId + ". Use 'typedumper list analyzers'");
                return RunResult.EXIT_FAILURE;
            }

            Optional<OutputRenderer> renderer = findRenderer(rendererId);
            if (renderer.isEmpty()) {
                log.error("Unknown renderer: {}", rendererId);
                System.err.println("✗ Unknown renderer: " + rendererId + ". Use 'typedumper list renderers'");
                return RunResult.EXIT_FAILURE;
            }

            System.out.println("Dumping " + binaryFile + " with " + metadataFile);
            System.out.println();

            DumpOrchestrator orchestrator = new DumpOrchestrator(
                analyzer.get(),
                new CSharpSourceRenderer(renderer.get()),
                new IdaPythonScriptRenderer(renderer.get()),
                new ToolchainLocator(new WildcardPathResolver(),
                    config.toolchain().rootMarker(), config.toolchain().assembliesMarker()),
                StageTimer.logging());

            RunResult result = orchestrator.run(binaryFile, metadataFile, options);
            printResult(result);
            return result.exitCode();

        } catch (Exception e) {
            log.error("Dump failed", e);
            System.err.println("✗ Dump failed: " + e.getMessage());
            return RunResult.EXIT_FAILURE;
        }
    }

    /**
     * Merges the command-line options over the configuration.
     *
     * @param config loaded configuration
     * @return run options
     * @throws IllegalArgumentException if a layout or sort order is unknown
     */
    DumpOptions buildOptions(DumperConfig config) {
        DumperConfig.OutputConfig output = config.output();
        DumperConfig.ToolchainConfig toolchain = config.toolchain();

        return DumpOptions.builder()
            .excludedNamespaces(resolveExclusions(excludedNamespaces, config.excludedNamespaces()))
            .layoutSchema(LayoutSchema.fromId(firstNonNull(layout, output.layout())))
            .sortOrder(SortOrder.fromId(firstNonNull(sort, output.sort())))
            .flattenHierarchy(flatten)
            .suppressMetadata(suppressMetadata)
            .mustCompile(mustCompile)
            .separateAssemblyAttributesFiles(separateAttributes)
            .createSolution(createSolution)
            .toolchainRoot(firstNonNull(toolchainRoot, toolchain.root()))
            .toolchainAssembliesRoot(firstNonNull(toolchainAssembliesRoot, toolchain.assembliesRoot()))
            .outputBasePath(firstNonNull(sourceOutput, output.sourcePath()))
            .scriptOutputPath(firstNonNull(scriptOutput, output.scriptPath()))
            .build();
    }

    /**
     * Resolves the namespace exclusion list. A single {@code none} entry clears it.
     *
     * @param given namespaces from the command line, or null if not given
     * @param configured namespaces from the configuration
     * @return namespaces to exclude
     */
    static Set<String> resolveExclusions(List<String> given, List<String> configured) {
        List<String> source = given == null ? configured : given;
        if (source.size() == 1 && NO_EXCLUSIONS.equals(source.get(0).trim().toLowerCase(Locale.ROOT))) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String namespace : source) {
            String trimmed = namespace.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * Finds an analyzer by ID via SPI.
     */
    private static Optional<BinaryAnalyzer> findAnalyzer(String id) {
        log.debug("Discovering analyzers via ServiceLoader");
        for (BinaryAnalyzer analyzer : ServiceLoader.load(BinaryAnalyzer.class)) {
            log.debug("  - {} ({})", analyzer.getId(), analyzer.getDisplayName());
            if (analyzer.getId().equalsIgnoreCase(id)) {
                return Optional.of(analyzer);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds an output renderer by ID via SPI.
     */
    private static Optional<OutputRenderer> findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }

    private static void printResult(RunResult result) {
        for (RunResult.ImageOutcome image : result.images()) {
            System.out.println("✓ Image " + image.imageName() + ": " + image.sourcePath()
                + ", " + image.scriptPath());
        }

        System.out.println();
        if (result.success()) {
            System.out.println("✓ Done");
        } else {
            RunResult.Failure failure = result.failure();
            System.err.println("✗ " + failure.kind() + ": " + failure.message());
        }
    }

    private static String firstNonNull(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
