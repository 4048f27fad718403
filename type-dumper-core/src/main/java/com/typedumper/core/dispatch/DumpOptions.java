package com.typedumper.core.dispatch;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of one dump run.
 *
 * <p>Solution mode ({@code createSolution}) overrides three settings for dispatch
 * without changing the configured values: the effective layout is
 * {@link LayoutSchema#TREE}, and compile tidying and separate attribute files are on.
 * Read the {@code effective*} accessors when deciding what to do.
 *
 * @param excludedNamespaces namespaces left out of the source output
 * @param layoutSchema configured layout
 * @param sortOrder configured sort order
 * @param flattenHierarchy flatten namespace folders (namespace and class layouts)
 * @param suppressMetadata omit pointers, offsets and indices from the source output
 * @param mustCompile configured compile tidying
 * @param separateAssemblyAttributesFiles configured attribute file separation (assembly and tree layouts)
 * @param createSolution generate a solution with projects
 * @param toolchainRoot toolchain root path, may contain wildcards
 * @param toolchainAssembliesRoot toolchain script assemblies path, may contain wildcards
 * @param outputBasePath base path of the source output
 * @param scriptOutputPath base path of the script output
 */
public record DumpOptions(
    Set<String> excludedNamespaces,
    LayoutSchema layoutSchema,
    SortOrder sortOrder,
    boolean flattenHierarchy,
    boolean suppressMetadata,
    boolean mustCompile,
    boolean separateAssemblyAttributesFiles,
    boolean createSolution,
    String toolchainRoot,
    String toolchainAssembliesRoot,
    String outputBasePath,
    String scriptOutputPath
) {
    /**
     * Compact constructor with validation.
     */
    public DumpOptions {
        Objects.requireNonNull(outputBasePath, "outputBasePath must not be null");
        Objects.requireNonNull(scriptOutputPath, "scriptOutputPath must not be null");
        excludedNamespaces = excludedNamespaces == null ? Set.of() : Set.copyOf(excludedNamespaces);
        if (toolchainRoot == null) {
            toolchainRoot = "";
        }
        if (toolchainAssembliesRoot == null) {
            toolchainAssembliesRoot = "";
        }
    }

    /**
     * Returns the layout dispatch uses.
     *
     * @return TREE in solution mode, otherwise the configured layout (may be null)
     */
    public LayoutSchema effectiveLayoutSchema() {
        return createSolution ? LayoutSchema.TREE : layoutSchema;
    }

    /**
     * Returns whether compile tidying applies.
     *
     * @return true in solution mode, otherwise the configured value
     */
    public boolean effectiveMustCompile() {
        return createSolution || mustCompile;
    }

    /**
     * Returns whether assembly attributes go to separate files.
     *
     * @return true in solution mode, otherwise the configured value
     */
    public boolean effectiveSeparateAssemblyAttributesFiles() {
        return createSolution || separateAssemblyAttributesFiles;
    }

    /**
     * Starts a builder with the command line defaults.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link DumpOptions}.
     */
    public static final class Builder {
        private Set<String> excludedNamespaces = Set.of();
        private LayoutSchema layoutSchema = LayoutSchema.SINGLE;
        private SortOrder sortOrder = SortOrder.INDEX;
        private boolean flattenHierarchy;
        private boolean suppressMetadata;
        private boolean mustCompile;
        private boolean separateAssemblyAttributesFiles;
        private boolean createSolution;
        private String toolchainRoot = "";
        private String toolchainAssembliesRoot = "";
        private String outputBasePath = "types.cs";
        private String scriptOutputPath = "ida.py";

        private Builder() {
        }

        public Builder excludedNamespaces(Set<String> excludedNamespaces) {
            this.excludedNamespaces = excludedNamespaces;
            return this;
        }

        public Builder layoutSchema(LayoutSchema layoutSchema) {
            this.layoutSchema = layoutSchema;
            return this;
        }

        public Builder sortOrder(SortOrder sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder flattenHierarchy(boolean flattenHierarchy) {
            this.flattenHierarchy = flattenHierarchy;
            return this;
        }

        public Builder suppressMetadata(boolean suppressMetadata) {
            this.suppressMetadata = suppressMetadata;
            return this;
        }

        public Builder mustCompile(boolean mustCompile) {
            this.mustCompile = mustCompile;
            return this;
        }

        public Builder separateAssemblyAttributesFiles(boolean separateAssemblyAttributesFiles) {
            this.separateAssemblyAttributesFiles = separateAssemblyAttributesFiles;
            return this;
        }

        public Builder createSolution(boolean createSolution) {
            this.createSolution = createSolution;
            return this;
        }

        public Builder toolchainRoot(String toolchainRoot) {
            this.toolchainRoot = toolchainRoot;
            return this;
        }

        public Builder toolchainAssembliesRoot(String toolchainAssembliesRoot) {
            this.toolchainAssembliesRoot = toolchainAssembliesRoot;
            return this;
        }

        public Builder outputBasePath(String outputBasePath) {
            this.outputBasePath = outputBasePath;
            return this;
        }

        public Builder scriptOutputPath(String scriptOutputPath) {
            this.scriptOutputPath = scriptOutputPath;
            return this;
        }

        public DumpOptions build() {
            return new DumpOptions(excludedNamespaces, layoutSchema, sortOrder, flattenHierarchy,
                suppressMetadata, mustCompile, separateAssemblyAttributesFiles, createSolution,
                toolchainRoot, toolchainAssembliesRoot, outputBasePath, scriptOutputPath);
        }
    }
}
