package com.typedumper.core.analysis.impl;

import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.model.AssemblyInfo;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ManifestAnalyzer} and {@link ManifestModelBuilder}.
 */
class ManifestAnalyzerTest {

    @TempDir
    Path tempDir;

    private ManifestAnalyzer analyzer;
    private Path binary;

    @BeforeEach
    void setUp() throws IOException {
        analyzer = new ManifestAnalyzer();
        binary = Files.write(tempDir.resolve("libil2cpp.so"), new byte[] {0x7F, 'E', 'L', 'F'});
    }

    @Test
    void metadata_exposesIdAndDisplayName() {
        assertThat(analyzer.getId()).isEqualTo("manifest");
        assertThat(analyzer.getDisplayName()).isEqualTo("Type Manifest Analyzer");
    }

    @Test
    void loadFromFile_json_returnsImagesInDocumentOrder() throws IOException {
        Path metadata = Files.writeString(tempDir.resolve("global-metadata.json"), """
            {
              "images": [
                {
                  "name": "GameAssembly",
                  "assemblies": [ { "name": "Assembly-CSharp.dll", "attributes": ["[assembly: Debuggable]"] } ],
                  "types": [
                    {
                      "index": 1,
                      "name": "Player",
                      "namespace": "Game",
                      "assembly": "Assembly-CSharp.dll",
                      "declaration": "public class Player",
                      "fields": [ { "declaration": "public int health;", "offset": 24 } ],
                      "methods": [ { "name": "Update", "declaration": "public void Update() { }", "address": 4096 } ]
                    }
                  ]
                },
                { "name": "Plugins", "unknownField": true }
              ]
            }
            """);

        List<BinaryImage> images = analyzer.loadFromFile(binary, metadata);

        assertThat(images).extracting(BinaryImage::name).containsExactly("GameAssembly", "Plugins");
        ManifestImage first = (ManifestImage) images.get(0);
        assertThat(first.assemblies()).containsExactly(
            new AssemblyInfo("Assembly-CSharp.dll", List.of("[assembly: Debuggable]")));
        TypeEntry player = first.types().get(0);
        assertThat(player.fullName()).isEqualTo("Game.Player");
        assertThat(player.fields()).containsExactly(new TypeEntry.Field("public int health;", 24, false));
        assertThat(player.methods().get(0).address()).isEqualTo(4096L);
        assertThat(((ManifestImage) images.get(1)).types()).isEmpty();
    }

    @Test
    void loadFromFile_yaml_isSelectedByExtension() throws IOException {
        Path metadata = Files.writeString(tempDir.resolve("global-metadata.yaml"), """
            images:
              - name: GameAssembly
                types:
                  - index: 0
                    name: Program
            """);

        List<BinaryImage> images = analyzer.loadFromFile(binary, metadata);

        assertThat(images).singleElement().satisfies(image -> assertThat(image.name()).isEqualTo("GameAssembly"));
    }

    @Test
    void loadFromFile_withoutImages_returnsNull() throws IOException {
        Path metadata = Files.writeString(tempDir.resolve("global-metadata.json"), "{ \"images\": [] }");

        assertThat(analyzer.loadFromFile(binary, metadata)).isNull();
    }

    @Test
    void loadFromFile_malformed_throwsIoException() throws IOException {
        Path metadata = Files.writeString(tempDir.resolve("global-metadata.json"), "{ \"images\": [ ");

        assertThatThrownBy(() -> analyzer.loadFromFile(binary, metadata))
            .isInstanceOf(IOException.class);
    }

    @Test
    void buildModel_sortsTypesAndAddsUndeclaredAssemblies() {
        ManifestImage image = new ManifestImage("GameAssembly",
            List.of(new AssemblyInfo("Assembly-CSharp.dll", List.of())),
            List.of(
                TypeEntry.of(4, "Object", "System", "mscorlib.dll"),
                TypeEntry.of(1, "Player", "Game", "Assembly-CSharp.dll"),
                TypeEntry.of(2, "Program", "", "")));

        TypeModel model = analyzer.modelBuilder().buildModel(image);

        assertThat(model.imageName()).isEqualTo("GameAssembly");
        assertThat(model.types()).extracting(TypeEntry::index).containsExactly(1, 2, 4);
        assertThat(model.assemblies()).extracting(AssemblyInfo::name)
            .containsExactly("Assembly-CSharp.dll", "mscorlib.dll");
        assertThat(model.assembly("mscorlib.dll")).isPresent();
    }

    @Test
    void buildModel_foreignImage_throwsIllegalArgument() {
        BinaryImage foreign = () -> "elsewhere";

        assertThatThrownBy(() -> analyzer.modelBuilder().buildModel(foreign))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
