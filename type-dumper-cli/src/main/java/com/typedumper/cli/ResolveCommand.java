package com.typedumper.cli;

import com.typedumper.core.path.UnsupportedPathException;
import com.typedumper.core.path.WildcardPathResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Command to resolve a wildcard path against the filesystem.
 *
 * <p>Each {@code *} segment is replaced by the greatest matching directory name, so
 * the result is the path the {@code dump} command would use for the toolchain.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * typedumper resolve "C:\Program Files\Unity\Hub\Editor\*"
 * }</pre>
 */
@Command(
    name = "resolve",
    description = "Resolve a path containing wildcard segments",
    mixinStandardHelpOptions = true
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Parameters(index = "0", description = "Absolute path, may contain '*' in any segment")
    private String path;

    private final WildcardPathResolver resolver;

    /**
     * Creates a command resolving against the default filesystem.
     */
    public ResolveCommand() {
        this(new WildcardPathResolver());
    }

    ResolveCommand(WildcardPathResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(resolver.resolve(path));
            return 0;
        } catch (UnsupportedPathException e) {
            log.error("Cannot resolve {}: {}", e.getPath(), e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }
}
