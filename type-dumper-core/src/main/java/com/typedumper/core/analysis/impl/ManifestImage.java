package com.typedumper.core.analysis.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.model.AssemblyInfo;
import com.typedumper.core.model.TypeEntry;

import java.util.List;
import java.util.Objects;

/**
 * Image entry of a type manifest.
 *
 * @param name image name
 * @param assemblies assemblies of the image
 * @param types exported type definitions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestImage(
    @JsonProperty("name") String name,
    @JsonProperty("assemblies") List<AssemblyInfo> assemblies,
    @JsonProperty("types") List<TypeEntry> types
) implements BinaryImage {

    /**
     * Compact constructor with validation.
     */
    public ManifestImage {
        Objects.requireNonNull(name, "name must not be null");
        assemblies = assemblies == null ? List.of() : List.copyOf(assemblies);
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * Root of a type manifest file.
     *
     * @param images images in discovery order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Document(
        @JsonProperty("images") List<ManifestImage> images
    ) {
        public Document {
            images = images == null ? List.of() : List.copyOf(images);
        }
    }
}
