package com.typedumper.core.run;

import com.typedumper.core.config.DumperConfig;
import com.typedumper.core.model.Toolchain;
import com.typedumper.core.path.WildcardPathResolver;
import com.typedumper.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Locates the toolchain installation referenced by generated solutions.
 *
 * <p>Both configured paths are resolved with the {@link WildcardPathResolver}. A
 * resolved directory is accepted only if it exists and contains its marker file, which
 * rules out directories that merely match the wildcard pattern.
 */
public class ToolchainLocator {

    private static final Logger log = LoggerFactory.getLogger(ToolchainLocator.class);

    private final WildcardPathResolver resolver;
    private final String rootMarker;
    private final String assembliesMarker;

    /**
     * Creates a locator using the default marker files.
     *
     * @param resolver wildcard path resolver
     */
    public ToolchainLocator(WildcardPathResolver resolver) {
        this(resolver,
            DumperConfig.ToolchainConfig.DEFAULT_ROOT_MARKER,
            DumperConfig.ToolchainConfig.DEFAULT_ASSEMBLIES_MARKER);
    }

    /**
     * Creates a locator.
     *
     * @param resolver wildcard path resolver
     * @param rootMarker file expected below the toolchain root, relative path
     * @param assembliesMarker file expected in the assemblies directory, relative path
     */
    public ToolchainLocator(WildcardPathResolver resolver, String rootMarker, String assembliesMarker) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.rootMarker = Objects.requireNonNull(rootMarker, "rootMarker must not be null");
        this.assembliesMarker = Objects.requireNonNull(assembliesMarker, "assembliesMarker must not be null");
    }

    /**
     * Resolves and validates the toolchain paths.
     *
     * @param rootPattern toolchain root, may contain wildcards
     * @param assembliesPattern toolchain assemblies directory, may contain wildcards
     * @return resolved toolchain
     * @throws ToolchainNotFoundException if a directory or marker file is missing
     * @throws com.typedumper.core.path.UnsupportedPathException if a pattern has an unsupported shape
     */
    public Toolchain locate(String rootPattern, String assembliesPattern) throws ToolchainNotFoundException {
        String root = resolver.resolve(rootPattern);
        String assemblies = resolver.resolve(assembliesPattern);

        requireDirectory(root, "Toolchain path " + root + " does not exist");
        requireMarker(root, rootMarker, "No toolchain installation found at " + root);
        requireDirectory(assemblies, "Toolchain assemblies path " + assemblies + " does not exist");
        requireMarker(assemblies, assembliesMarker, "No toolchain assemblies found at " + assemblies);

        log.info("Using toolchain at {}", root);
        log.info("Using toolchain assemblies at {}", assemblies);
        return new Toolchain(root, assemblies);
    }

    private static void requireDirectory(String path, String message) throws ToolchainNotFoundException {
        if (!FileUtils.isDirectory(path)) {
            throw new ToolchainNotFoundException(path, message);
        }
    }

    private static void requireMarker(String directory, String marker, String message)
            throws ToolchainNotFoundException {
        String markerPath = FileUtils.join(directory, marker);
        boolean present = FileUtils.toPath(markerPath).map(FileUtils::isRegularFile).orElse(false);
        if (!present) {
            throw new ToolchainNotFoundException(markerPath, message);
        }
    }
}
