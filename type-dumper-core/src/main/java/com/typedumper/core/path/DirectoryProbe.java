package com.typedumper.core.path;

import java.util.List;

/**
 * Read-only view of the filesystem used while resolving wildcard paths.
 */
@FunctionalInterface
public interface DirectoryProbe {

    /**
     * Lists the names of the immediate child directories of a directory.
     *
     * <p>Implementations must not fail for a missing or unreadable directory; they
     * return an empty list instead.
     *
     * @param directory directory path string
     * @return child directory names (not full paths), in any order
     */
    List<String> listDirectories(String directory);
}
