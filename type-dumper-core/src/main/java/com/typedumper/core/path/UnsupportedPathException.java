package com.typedumper.core.path;

/**
 * Thrown when a wildcard path has a shape the resolver does not handle:
 * relative paths (including a wildcard as the first component) and network paths.
 */
public class UnsupportedPathException extends IllegalArgumentException {

    private final String path;

    public UnsupportedPathException(String path, String reason) {
        super("Unsupported wildcard path '" + path + "': " + reason);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
