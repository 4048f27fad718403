package com.typedumper.core.model;

import java.util.List;
import java.util.Set;

/**
 * Excludes types by namespace.
 *
 * <p>A namespace is excluded when it equals an entry or is nested below it:
 * {@code "System"} excludes {@code "System"} and {@code "System.Collections"} but not
 * {@code "SystemX"}.
 *
 * @param excludedNamespaces namespaces to exclude
 */
public record NamespaceFilter(Set<String> excludedNamespaces) {

    /**
     * Compact constructor with validation.
     */
    public NamespaceFilter {
        excludedNamespaces = excludedNamespaces == null ? Set.of() : Set.copyOf(excludedNamespaces);
    }

    /**
     * Returns a filter that excludes nothing.
     *
     * @return empty filter
     */
    public static NamespaceFilter none() {
        return new NamespaceFilter(Set.of());
    }

    /**
     * Checks whether a namespace is excluded.
     *
     * @param namespace namespace to check
     * @return true if the namespace matches or is nested in an excluded namespace
     */
    public boolean excludes(String namespace) {
        if (namespace == null || excludedNamespaces.isEmpty()) {
            return false;
        }
        for (String excluded : excludedNamespaces) {
            if (namespace.equals(excluded) || namespace.startsWith(excluded + ".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the types of a model whose namespace is not excluded, keeping their order.
     *
     * @param types types to filter
     * @return retained types
     */
    public List<TypeEntry> retain(List<TypeEntry> types) {
        return types.stream()
            .filter(t -> !excludes(t.namespace()))
            .toList();
    }

    /**
     * Returns a copy of the model without excluded types.
     *
     * @param model model to filter
     * @return filtered model
     */
    public TypeModel apply(TypeModel model) {
        if (excludedNamespaces.isEmpty()) {
            return model;
        }
        return model.withTypes(retain(model.types()));
    }
}
