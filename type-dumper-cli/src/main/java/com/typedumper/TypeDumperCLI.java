package com.typedumper;

import com.typedumper.cli.DumpCommand;
import com.typedumper.cli.ListCommand;
import com.typedumper.cli.ResolveCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for TypeDumper.
 *
 * <p>TypeDumper turns the type information of a compiled binary and its metadata file
 * into readable C# declarations, plus an IDA Python script that names every method.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code dump} - Dump types of a binary and metadata pair</li>
 *   <li>{@code resolve} - Resolve a wildcard path against the filesystem</li>
 *   <li>{@code list} - List layouts, sort orders or analyzers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Dump into one file per namespace, sorted by name
 * typedumper dump -i libil2cpp.so -m global-metadata.dat -c out/types.cs -l namespace -s name
 *
 * # Generate a buildable solution
 * typedumper dump -j -c out/
 *
 * # List available layouts
 * typedumper list layouts
 * }</pre>
 */
@Command(
    name = "typedumper",
    mixinStandardHelpOptions = true,
    version = "TypeDumper 1.0.0-SNAPSHOT",
    description = "Dumps type declarations and method symbols from compiled binaries",
    subcommands = {
        DumpCommand.class,
        ResolveCommand.class,
        ListCommand.class
    }
)
public class TypeDumperCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TypeDumperCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("TypeDumper - Type declaration and symbol dumper");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'typedumper --help' to see available commands");
        System.out.println("Use 'typedumper <command> --help' for command-specific help");
    }

    /**
     * Configures the logging level from the global options. Runs before any
     * subcommand, so {@code -v} and {@code -q} apply to all of them.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line, applying the global logging options before the
     * selected subcommand executes.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TypeDumperCLI cli = new TypeDumperCLI();
        CommandLine commandLine = new CommandLine(cli);
        CommandLine.IExecutionStrategy delegate = commandLine.getExecutionStrategy();
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return delegate.execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
