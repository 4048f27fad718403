package com.typedumper.core.util;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Utility class for path string and file operations.
 *
 * <p>Path strings handled here may use either {@code /} or {@code \} as separator,
 * independently of the platform the tool runs on.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Checks whether a character is a path separator.
     *
     * @param c character to check
     * @return true for {@code /} and {@code \}
     */
    public static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    /**
     * Returns the index of the last path separator in a path string.
     *
     * @param path path string
     * @return separator index, or -1 if the path has a single segment
     */
    public static int lastSeparatorIndex(String path) {
        return Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    }

    /**
     * Returns the index of the dot that starts the extension of the final path segment.
     *
     * <p>A leading dot (hidden file) or a trailing dot is not an extension.
     *
     * @param path path string
     * @return dot index, or -1 if the final segment has no extension
     */
    public static int extensionDotIndex(String path) {
        int segmentStart = lastSeparatorIndex(path) + 1;
        int dot = path.lastIndexOf('.');
        if (dot <= segmentStart || dot == path.length() - 1) {
            return -1;
        }
        return dot;
    }

    /**
     * Gets the file extension of the final path segment.
     *
     * @param path path string
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(String path) {
        int dot = extensionDotIndex(path);
        return dot < 0 ? "" : path.substring(dot + 1);
    }

    /**
     * Appends a relative path to a base path string, using the separator style of the base.
     *
     * <p>Windows-style bases such as {@code C:\Unity} keep backslashes so the result can
     * be embedded in files consumed on that platform.
     *
     * @param base base path string
     * @param relative relative path using {@code /} separators
     * @return joined path string
     */
    public static String join(String base, String relative) {
        char separator = base.indexOf('\\') >= 0 ? '\\' : '/';
        String child = relative.replace('/', separator).replace('\\', separator);
        if (base.isEmpty()) {
            return child;
        }
        return isSeparator(base.charAt(base.length() - 1)) ? base + child : base + separator + child;
    }

    /**
     * Converts a path string to a {@link Path}, if the platform accepts it.
     *
     * <p>Unresolved wildcard segments are not valid path characters on every platform.
     *
     * @param path path string
     * @return the path, or empty if the string is not a valid path here
     */
    public static Optional<Path> toPath(String path) {
        try {
            return Optional.of(Paths.get(path));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    /**
     * Checks if a directory exists at the given path string.
     *
     * @param path path string
     * @return true if it names an existing directory
     */
    public static boolean isDirectory(String path) {
        return toPath(path).map(Files::isDirectory).orElse(false);
    }

    /**
     * Checks if a regular file exists at the given path.
     *
     * @param path path to check
     * @return true if the file exists
     */
    public static boolean isRegularFile(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * Replaces characters that are not allowed in file names on common platforms.
     *
     * <p>Empty names and names made only of dots become {@code _}, so the result never
     * refers to the current or parent directory.
     *
     * @param name raw name (e.g. a generic type name such as {@code List`1})
     * @return name usable as a single path segment
     */
    public static String sanitizeFileName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if ("<>:\"/\\|?*`".indexOf(c) >= 0 || Character.isISOControl(c)) {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }
        String sanitized = sb.toString();
        return sanitized.chars().allMatch(c -> c == '.') ? "_" : sanitized;
    }

    /**
     * Turns a dotted namespace into a relative path, sanitizing every part.
     *
     * <p>Empty parts (as in {@code .Evil} or {@code A..B}) become {@code _}.
     *
     * @param namespace dotted namespace, not empty
     * @param separator joins the parts, {@code '/'} for directories or {@code '.'} for flat names
     * @return relative path that stays below the directory it is resolved against
     */
    public static String namespacePath(String namespace, char separator) {
        StringBuilder sb = new StringBuilder(namespace.length());
        for (String part : namespace.split("\\.", -1)) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(sanitizeFileName(part));
        }
        return sb.toString();
    }
}
