package com.typedumper.core.analysis.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.typedumper.core.analysis.BinaryAnalyzer;
import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.analysis.TypeModelBuilder;
import com.typedumper.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Analyzer reading an exported type manifest instead of parsing native metadata.
 *
 * <p>The metadata file holds the already reconstructed model as JSON, or as YAML when
 * its extension is {@code .yaml} or {@code .yml}. The binary file must be present but
 * is not read.
 *
 * <p><b>Manifest format:</b>
 * <pre>{@code
 * {
 *   "images": [{
 *     "name": "GameAssembly",
 *     "assemblies": [{ "name": "Assembly-CSharp.dll", "attributes": ["[assembly: AssemblyVersion(\"1.0.0.0\")]"] }],
 *     "types": [{
 *       "index": 0, "name": "Player", "namespace": "Game", "assembly": "Assembly-CSharp.dll",
 *       "declaration": "public class Player : MonoBehaviour",
 *       "fields":  [{ "declaration": "private int health;", "offset": 24 }],
 *       "methods": [{ "name": "Jump", "declaration": "public void Jump();", "address": 4198400 }]
 *     }]
 *   }]
 * }
 * }</pre>
 */
public class ManifestAnalyzer implements BinaryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ManifestAnalyzer.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ManifestModelBuilder modelBuilder = new ManifestModelBuilder();

    @Override
    public String getId() {
        return "manifest";
    }

    @Override
    public String getDisplayName() {
        return "Type Manifest Analyzer";
    }

    /**
     * Reads the manifest.
     *
     * @param binaryFile native binary (not read)
     * @param metadataFile manifest file
     * @return images in file order, or null if the manifest is empty
     * @throws IOException if the manifest cannot be read or parsed
     */
    @Override
    public List<BinaryImage> loadFromFile(Path binaryFile, Path metadataFile) throws IOException {
        log.debug("Reading type manifest from: {}", metadataFile);
        ManifestImage.Document document = mapperFor(metadataFile)
            .readValue(metadataFile.toFile(), ManifestImage.Document.class);

        if (document == null || document.images().isEmpty()) {
            log.warn("Type manifest {} contains no images", metadataFile);
            return null;
        }

        log.info("Loaded {} images from {}", document.images().size(), metadataFile);
        return List.copyOf(document.images());
    }

    @Override
    public TypeModelBuilder modelBuilder() {
        return modelBuilder;
    }

    private static ObjectMapper mapperFor(Path metadataFile) {
        String extension = FileUtils.getExtension(metadataFile.toString()).toLowerCase(Locale.ROOT);
        return extension.equals("yaml") || extension.equals("yml") ? YAML_MAPPER : JSON_MAPPER;
    }
}
