package com.typedumper.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("typedumper.yaml");
        Files.writeString(configFile, """
            excludedNamespaces:
              - System
              - Mono

            output:
              layout: namespace
              sort: name
              sourcePath: out/types.cs
              scriptPath: out/ida.py

            toolchain:
              root: '/opt/unity/Hub/Editor/*'
              assembliesRoot: '/opt/unity/Hub/Editor/*/ScriptAssemblies'
              rootMarker: Editor/Data/Managed/UnityEditor.dll
              assembliesMarker: UnityEngine.UI.dll
            """);

        DumperConfig config = ConfigLoader.load(configFile);

        assertThat(config.excludedNamespaces()).containsExactly("System", "Mono");
        assertThat(config.output().layout()).isEqualTo("namespace");
        assertThat(config.output().sort()).isEqualTo("name");
        assertThat(config.output().sourcePath()).isEqualTo("out/types.cs");
        assertThat(config.output().scriptPath()).isEqualTo("out/ida.py");
        assertThat(config.toolchain().root()).isEqualTo("/opt/unity/Hub/Editor/*");
        assertThat(config.toolchain().assembliesRoot()).isEqualTo("/opt/unity/Hub/Editor/*/ScriptAssemblies");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("typedumper.yaml");
        Files.writeString(configFile, """
            output:
              layout: tree
            """);

        DumperConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().layout()).isEqualTo("tree");
        assertThat(config.output().sort()).isEqualTo("index");
        assertThat(config.output().sourcePath()).isEqualTo("types.cs");
        assertThat(config.excludedNamespaces()).isEqualTo(DumperConfig.DEFAULT_EXCLUDED_NAMESPACES);
        assertThat(config.toolchain()).isEqualTo(DumperConfig.ToolchainConfig.defaults());
    }

    @Test
    void load_emptyExclusionList_keepsItEmpty() throws IOException {
        Path configFile = tempDir.resolve("typedumper.yaml");
        Files.writeString(configFile, "excludedNamespaces: []\n");

        DumperConfig config = ConfigLoader.load(configFile);

        assertThat(config.excludedNamespaces()).isEmpty();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        DumperConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(DumperConfig.defaults());
        assertThat(config.excludedNamespaces()).contains("System", "UnityEngine", "JetBrains.Annotations");
        assertThat(config.toolchain().rootMarker()).isEqualTo("Editor/Data/Managed/UnityEditor.dll");
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve("typedumper.yaml"), "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(DumperConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve("typedumper.yaml"), "output: [unclosed\n");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(DumperConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(DumperConfig.defaults());
    }
}
