package com.typedumper.core.path;

import com.typedumper.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves paths containing {@code *} wildcards to concrete directories.
 *
 * <p>Each path segment containing {@code *} is a glob over the names of the child
 * directories of the path resolved so far; {@code *} matches any run of characters
 * within that segment. Among the matches the ordinal-greatest name is selected, so
 * {@code C:\Program Files\Unity\Hub\Editor\*} picks the highest-named installed
 * version. Names are compared as strings: {@code v2} wins over {@code v10}.
 *
 * <p>A wildcard segment with no match is kept literally and resolution continues.
 * The result then names a directory that does not exist, which the caller detects
 * with its own existence check.
 *
 * <p><b>Supported inputs:</b>
 * <ul>
 *   <li>paths without {@code *}: returned unchanged, the filesystem is not touched</li>
 *   <li>absolute paths rooted at {@code /} or {@code \}</li>
 *   <li>drive-rooted paths such as {@code C:\...} or {@code C:/...}</li>
 * </ul>
 * Relative wildcard paths and network paths ({@code \\server\share}) raise
 * {@link UnsupportedPathException}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * WildcardPathResolver resolver = new WildcardPathResolver();
 * String editor = resolver.resolve("/opt/unity/Hub/Editor/*");
 * // "/opt/unity/Hub/Editor/2019.3.7f1" when 2019.2.0f1 and 2019.3.7f1 are installed
 * }</pre>
 */
public class WildcardPathResolver {

    private static final Logger log = LoggerFactory.getLogger(WildcardPathResolver.class);

    private static final char WILDCARD = '*';

    private final DirectoryProbe probe;

    /**
     * Creates a resolver over the default filesystem.
     */
    public WildcardPathResolver() {
        this(new FileSystemDirectoryProbe());
    }

    /**
     * Creates a resolver over the given probe.
     *
     * @param probe directory listing source
     */
    public WildcardPathResolver(DirectoryProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
    }

    /**
     * Resolves a path that may contain wildcard segments.
     *
     * @param path path string
     * @return resolved path, never null
     * @throws UnsupportedPathException if the path contains a wildcard and is relative or a network path
     */
    public String resolve(String path) {
        Objects.requireNonNull(path, "path must not be null");

        if (path.indexOf(WILDCARD) < 0) {
            return path;
        }

        String root = rootOf(path);
        char separator = root.charAt(root.length() - 1);

        StringBuilder resolved = new StringBuilder(root);
        for (String segment : segmentsAfter(path, root)) {
            String next = segment.indexOf(WILDCARD) < 0
                ? segment
                : selectDirectory(resolved.toString(), segment);
            appendSegment(resolved, next, separator);
        }

        log.debug("Resolved wildcard path {} to {}", path, resolved);
        return resolved.toString();
    }

    /**
     * Picks the ordinal-greatest child directory matching a wildcard segment, or the
     * segment itself if nothing matches.
     */
    private String selectDirectory(String parent, String pattern) {
        Pattern glob = compileSegmentGlob(pattern);

        Optional<String> selected = probe.listDirectories(parent).stream()
            .filter(name -> glob.matcher(name).matches())
            .max(Comparator.naturalOrder());

        if (selected.isEmpty()) {
            log.debug("No directory in {} matches {}, keeping the pattern literally", parent, pattern);
            return pattern;
        }
        log.debug("Selected {} for {} in {}", selected.get(), pattern, parent);
        return selected.get();
    }

    /**
     * Compiles a single-segment glob: {@code *} matches any characters, everything
     * else is literal.
     *
     * @param pattern segment pattern
     * @return compiled pattern matching whole names
     */
    static Pattern compileSegmentGlob(String pattern) {
        String[] literals = pattern.split("\\*", -1);
        String regex = Arrays.stream(literals)
            .map(literal -> literal.isEmpty() ? "" : Pattern.quote(literal))
            .collect(Collectors.joining(".*"));
        return Pattern.compile(regex, Pattern.DOTALL);
    }

    /**
     * Returns the root component of an absolute path, including its trailing separator.
     */
    private static String rootOf(String path) {
        if (path.length() >= 2 && FileUtils.isSeparator(path.charAt(0)) && FileUtils.isSeparator(path.charAt(1))) {
            throw new UnsupportedPathException(path, "network paths are not supported");
        }
        if (FileUtils.isSeparator(path.charAt(0))) {
            return path.substring(0, 1);
        }
        if (path.length() >= 3
                && Character.isLetter(path.charAt(0))
                && path.charAt(1) == ':'
                && FileUtils.isSeparator(path.charAt(2))) {
            return path.substring(0, 3);
        }
        throw new UnsupportedPathException(path, "wildcard paths must be absolute");
    }

    private static List<String> segmentsAfter(String path, String root) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.substring(root.length()).split("[/\\\\]+")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static void appendSegment(StringBuilder resolved, String segment, char separator) {
        if (resolved.length() > 0 && !FileUtils.isSeparator(resolved.charAt(resolved.length() - 1))) {
            resolved.append(separator);
        }
        resolved.append(segment);
    }
}
