package com.typedumper.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconstructed type model of a single image.
 *
 * <p>Types are kept in the order supplied by the model builder. Renderers apply
 * their own ordering on top of it.
 *
 * @param imageName name of the image this model was built from
 * @param assemblies assemblies of the image
 * @param types type definitions of the image
 */
public record TypeModel(
    String imageName,
    List<AssemblyInfo> assemblies,
    List<TypeEntry> types
) {
    /**
     * Compact constructor with validation.
     */
    public TypeModel {
        Objects.requireNonNull(imageName, "imageName must not be null");
        assemblies = assemblies == null ? List.of() : List.copyOf(assemblies);
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * Returns a copy of this model holding only the given types.
     *
     * @param retained types to keep
     * @return new model with the same image name and assemblies
     */
    public TypeModel withTypes(List<TypeEntry> retained) {
        return new TypeModel(imageName, assemblies, retained);
    }

    /**
     * Looks up an assembly by name.
     *
     * @param name assembly name
     * @return the assembly, if present
     */
    public Optional<AssemblyInfo> assembly(String name) {
        return assemblies.stream()
            .filter(a -> a.name().equals(name))
            .findFirst();
    }
}
