package com.typedumper.core.analysis;

import com.typedumper.core.renderer.OutputRenderer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the default collaborators are registered for SPI discovery.
 */
class AnalyzerServiceLoaderTest {

    @Test
    void serviceLoader_discoversManifestAnalyzer() {
        List<BinaryAnalyzer> analyzers = new ArrayList<>();
        ServiceLoader.load(BinaryAnalyzer.class).forEach(analyzers::add);

        assertThat(analyzers).extracting(BinaryAnalyzer::getId).contains("manifest");
        assertThat(analyzers).allSatisfy(a -> assertThat(a.modelBuilder()).isNotNull());
    }

    @Test
    void serviceLoader_discoversFileSystemRenderer() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);

        assertThat(renderers).extracting(OutputRenderer::getId).contains("filesystem");
    }
}
