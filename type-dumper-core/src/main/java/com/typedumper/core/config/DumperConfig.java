package com.typedumper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Configuration defaults for TypeDumper runs.
 *
 * <p>Loaded from {@code typedumper.yaml}. Every value can be overridden on the command
 * line; the file only changes what an omitted option means.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * excludedNamespaces:
 *   - System
 *   - UnityEngine
 *
 * output:
 *   layout: namespace
 *   sort: name
 *   sourcePath: "./out/cs"
 *   scriptPath: "./out/ida.py"
 *
 * toolchain:
 *   root: 'D:\Unity\Hub\Editor\*'
 *   assembliesRoot: 'D:\Unity\Hub\Editor\*\Editor\Data\Resources\PackageManager\ProjectTemplates\libcache\com.unity.template.3d-*\ScriptAssemblies'
 *   rootMarker: "Editor/Data/Managed/UnityEditor.dll"
 *   assembliesMarker: "UnityEngine.UI.dll"
 * }</pre>
 *
 * @param excludedNamespaces namespaces left out of the source output
 * @param output output defaults
 * @param toolchain toolchain location defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DumperConfig(
    @JsonProperty("excludedNamespaces") List<String> excludedNamespaces,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("toolchain") ToolchainConfig toolchain
) {
    /** Namespaces excluded when nothing else is configured. */
    public static final List<String> DEFAULT_EXCLUDED_NAMESPACES = List.of(
        "System",
        "Mono",
        "Microsoft.Win32",
        "Unity",
        "UnityEditor",
        "UnityEngine",
        "UnityEngineInternal",
        "AOT",
        "JetBrains.Annotations"
    );

    /**
     * Compact constructor filling missing sections with defaults.
     */
    public DumperConfig {
        if (excludedNamespaces == null) {
            excludedNamespaces = DEFAULT_EXCLUDED_NAMESPACES;
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
        if (toolchain == null) {
            toolchain = ToolchainConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static DumperConfig defaults() {
        return new DumperConfig(null, null, null);
    }

    /**
     * Output defaults.
     *
     * @param layout layout identifier
     * @param sort sort order identifier
     * @param sourcePath source output base path
     * @param scriptPath script output base path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("layout") String layout,
        @JsonProperty("sort") String sort,
        @JsonProperty("sourcePath") String sourcePath,
        @JsonProperty("scriptPath") String scriptPath
    ) {
        public OutputConfig {
            if (layout == null) {
                layout = "single";
            }
            if (sort == null) {
                sort = "index";
            }
            if (sourcePath == null) {
                sourcePath = "types.cs";
            }
            if (scriptPath == null) {
                scriptPath = "ida.py";
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null, null, null);
        }
    }

    /**
     * Toolchain location defaults for solution mode.
     *
     * <p>The root and assemblies paths may contain {@code *} wildcards. A resolved path
     * is only accepted if it contains its marker file.
     *
     * @param root toolchain (editor) root
     * @param assembliesRoot toolchain script assemblies directory
     * @param rootMarker file expected below the root, relative path
     * @param assembliesMarker file expected in the assemblies directory, relative path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToolchainConfig(
        @JsonProperty("root") String root,
        @JsonProperty("assembliesRoot") String assembliesRoot,
        @JsonProperty("rootMarker") String rootMarker,
        @JsonProperty("assembliesMarker") String assembliesMarker
    ) {
        public static final String DEFAULT_ROOT = "C:\\Program Files\\Unity\\Hub\\Editor\\*";
        public static final String DEFAULT_ASSEMBLIES_ROOT = "C:\\Program Files\\Unity\\Hub\\Editor\\*\\Editor\\Data"
            + "\\Resources\\PackageManager\\ProjectTemplates\\libcache\\com.unity.template.3d-*\\ScriptAssemblies";
        public static final String DEFAULT_ROOT_MARKER = "Editor/Data/Managed/UnityEditor.dll";
        public static final String DEFAULT_ASSEMBLIES_MARKER = "UnityEngine.UI.dll";

        public ToolchainConfig {
            if (root == null) {
                root = DEFAULT_ROOT;
            }
            if (assembliesRoot == null) {
                assembliesRoot = DEFAULT_ASSEMBLIES_ROOT;
            }
            if (rootMarker == null) {
                rootMarker = DEFAULT_ROOT_MARKER;
            }
            if (assembliesMarker == null) {
                assembliesMarker = DEFAULT_ASSEMBLIES_MARKER;
            }
        }

        public static ToolchainConfig defaults() {
            return new ToolchainConfig(null, null, null, null);
        }
    }
}
