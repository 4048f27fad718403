package com.typedumper.core.dispatch;

import com.typedumper.core.model.TypeEntry;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Order of type definitions inside an artifact.
 */
public enum SortOrder {
    /** By type definition index */
    INDEX("index", Comparator.comparingInt(TypeEntry::index)),

    /** By type name, ordinal comparison */
    NAME("name", Comparator.comparing(TypeEntry::name));

    private final String id;
    private final Comparator<TypeEntry> comparator;

    SortOrder(String id, Comparator<TypeEntry> comparator) {
        this.id = id;
        this.comparator = comparator;
    }

    public String id() {
        return id;
    }

    /**
     * Returns the comparator implementing this order.
     *
     * @return type comparator
     */
    public Comparator<TypeEntry> comparator() {
        return comparator;
    }

    /**
     * Parses a sort order identifier, ignoring case.
     *
     * @param id identifier such as "index" or "name"
     * @return sort order
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static SortOrder fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (SortOrder order : values()) {
                if (order.id.equals(normalized)) {
                    return order;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sort order '" + id + "'. Use one of: " + ids());
    }

    public static String ids() {
        return Arrays.stream(values()).map(SortOrder::id).collect(Collectors.joining(", "));
    }
}
