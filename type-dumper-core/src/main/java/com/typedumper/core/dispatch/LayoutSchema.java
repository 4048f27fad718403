package com.typedumper.core.dispatch;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Partitioning of source output into files.
 */
public enum LayoutSchema {
    /** All types in one file */
    SINGLE("single", true),

    /** One file per namespace, in namespace folders */
    NAMESPACE("namespace", true),

    /** One file per assembly */
    ASSEMBLY("assembly", true),

    /** One file per type, in namespace folders */
    CLASS("class", false),

    /** One file per type, in assembly and namespace folders */
    TREE("tree", false);

    private final String id;
    private final boolean ordered;

    LayoutSchema(String id, boolean ordered) {
        this.id = id;
        this.ordered = ordered;
    }

    /**
     * Returns the identifier used on the command line and in configuration.
     *
     * @return lowercase identifier
     */
    public String id() {
        return id;
    }

    /**
     * Whether several types share an artifact, so a sort order applies.
     *
     * @return true for layouts that honour the sort order
     */
    public boolean isOrdered() {
        return ordered;
    }

    /**
     * Parses a layout identifier, ignoring case.
     *
     * @param id identifier such as "single" or "TREE"
     * @return layout schema
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static LayoutSchema fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (LayoutSchema layout : values()) {
                if (layout.id.equals(normalized)) {
                    return layout;
                }
            }
        }
        throw new IllegalArgumentException("Unknown layout '" + id + "'. Use one of: " + ids());
    }

    /**
     * Returns all identifiers, comma separated.
     *
     * @return identifier list
     */
    public static String ids() {
        return Arrays.stream(values()).map(LayoutSchema::id).collect(Collectors.joining(", "));
    }
}
