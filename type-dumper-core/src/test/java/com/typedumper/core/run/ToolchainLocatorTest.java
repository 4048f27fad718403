package com.typedumper.core.run;

import com.typedumper.core.model.Toolchain;
import com.typedumper.core.path.UnsupportedPathException;
import com.typedumper.core.path.WildcardPathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ToolchainLocator}.
 */
class ToolchainLocatorTest {

    @TempDir
    Path tempDir;

    private ToolchainLocator locator;
    private String rootPattern;
    private String assembliesPattern;

    @BeforeEach
    void setUp() {
        locator = new ToolchainLocator(new WildcardPathResolver());
        rootPattern = tempDir.toAbsolutePath() + "/Editor/*";
        assembliesPattern = tempDir.toAbsolutePath() + "/cache/3d-*/ScriptAssemblies";
    }

    @Test
    void locate_withMarkers_returnsResolvedToolchain() throws Exception {
        Path editor = installEditor("2020.1.0f1");
        Path assemblies = installAssemblies("3d-5.0.4");
        Files.createDirectories(tempDir.resolve("cache/3d-4.2.8/ScriptAssemblies"));

        Toolchain toolchain = locator.locate(rootPattern, assembliesPattern);

        assertThat(Path.of(toolchain.editorPath())).isEqualTo(editor);
        assertThat(Path.of(toolchain.assembliesPath())).isEqualTo(assemblies);
    }

    @Test
    void locate_missingRoot_throwsNotFound() throws IOException {
        installAssemblies("3d-5.0.4");

        assertThatThrownBy(() -> locator.locate(rootPattern, assembliesPattern))
            .isInstanceOf(ToolchainNotFoundException.class)
            .hasMessageContaining("does not exist")
            .satisfies(e -> assertThat(((ToolchainNotFoundException) e).getPath()).endsWith("/Editor/*"));
    }

    @Test
    void locate_greatestVersionWithoutMarker_throwsNotFound() throws IOException {
        installEditor("2019.4.1f1");
        Files.createDirectories(tempDir.resolve("Editor/2020.1.0f1"));
        installAssemblies("3d-5.0.4");

        assertThatThrownBy(() -> locator.locate(rootPattern, assembliesPattern))
            .isInstanceOf(ToolchainNotFoundException.class)
            .hasMessageContaining("No toolchain installation found")
            .satisfies(e -> assertThat(((ToolchainNotFoundException) e).getPath())
                .endsWith("UnityEditor.dll")
                .contains("2020.1.0f1"));
    }

    @Test
    void locate_assembliesWithoutMarker_throwsNotFound() throws IOException {
        installEditor("2020.1.0f1");
        Files.createDirectories(tempDir.resolve("cache/3d-5.0.4/ScriptAssemblies"));

        assertThatThrownBy(() -> locator.locate(rootPattern, assembliesPattern))
            .isInstanceOf(ToolchainNotFoundException.class)
            .hasMessageContaining("No toolchain assemblies found");
    }

    @Test
    void locate_customMarkers_areProbed() throws Exception {
        Files.createDirectories(tempDir.resolve("Editor/2020.1.0f1"));
        Files.writeString(tempDir.resolve("Editor/2020.1.0f1/editor.marker"), "");
        Files.createDirectories(tempDir.resolve("cache/3d-1/ScriptAssemblies"));
        Files.writeString(tempDir.resolve("cache/3d-1/ScriptAssemblies/ui.marker"), "");
        ToolchainLocator custom = new ToolchainLocator(new WildcardPathResolver(), "editor.marker", "ui.marker");

        assertThat(custom.locate(rootPattern, assembliesPattern).editorPath()).endsWith("2020.1.0f1");
    }

    @Test
    void locate_relativeWildcardPath_throwsUnsupportedPath() {
        assertThatThrownBy(() -> locator.locate("Editor/*", assembliesPattern))
            .isInstanceOf(UnsupportedPathException.class);
    }

    private Path installEditor(String version) throws IOException {
        Path editor = tempDir.resolve("Editor").resolve(version);
        Path managed = Files.createDirectories(editor.resolve("Editor/Data/Managed"));
        Files.writeString(managed.resolve("UnityEditor.dll"), "");
        return editor;
    }

    private Path installAssemblies(String template) throws IOException {
        Path assemblies = Files.createDirectories(tempDir.resolve("cache").resolve(template).resolve("ScriptAssemblies"));
        Files.writeString(assemblies.resolve("UnityEngine.UI.dll"), "");
        return assemblies;
    }
}
