package com.typedumper.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An assembly contained in an image, with its assembly-level attributes.
 *
 * @param name assembly file name (e.g. "Assembly-CSharp.dll")
 * @param attributes rendered assembly attribute lines (e.g. {@code "[assembly: AssemblyVersion(\"1.0.0.0\")]"})
 */
public record AssemblyInfo(
    String name,
    List<String> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public AssemblyInfo {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    /**
     * Returns the assembly name without its ".dll" or ".exe" extension.
     *
     * @return short name
     */
    public String shortName() {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".dll") || lower.endsWith(".exe")) {
            return name.substring(0, name.length() - 4);
        }
        return name;
    }
}
