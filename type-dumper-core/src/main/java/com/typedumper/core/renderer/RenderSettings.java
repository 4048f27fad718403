package com.typedumper.core.renderer;

import com.typedumper.core.model.NamespaceFilter;

import java.util.Set;

/**
 * Per-run switches forwarded to a {@link SourceRenderer}.
 *
 * @param excludedNamespaces namespaces whose types are omitted
 * @param suppressMetadata omit method pointers, field offsets and type indices
 * @param mustCompile omit compiler-generated types and members
 */
public record RenderSettings(
    Set<String> excludedNamespaces,
    boolean suppressMetadata,
    boolean mustCompile
) {
    /**
     * Compact constructor with validation.
     */
    public RenderSettings {
        excludedNamespaces = excludedNamespaces == null ? Set.of() : Set.copyOf(excludedNamespaces);
    }

    /**
     * Returns settings that exclude nothing and emit all metadata.
     *
     * @return default settings
     */
    public static RenderSettings defaults() {
        return new RenderSettings(Set.of(), false, false);
    }

    /**
     * Returns the namespace filter for the excluded namespaces.
     *
     * @return namespace filter
     */
    public NamespaceFilter namespaceFilter() {
        return new NamespaceFilter(excludedNamespaces);
    }
}
