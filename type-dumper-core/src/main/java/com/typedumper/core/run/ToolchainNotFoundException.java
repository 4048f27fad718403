package com.typedumper.core.run;

/**
 * Thrown when a resolved toolchain directory or its marker file does not exist.
 */
public class ToolchainNotFoundException extends Exception {

    private final String path;

    public ToolchainNotFoundException(String path, String message) {
        super(message);
        this.path = path;
    }

    /**
     * Returns the missing path.
     *
     * @return directory or marker file path
     */
    public String getPath() {
        return path;
    }
}
