package com.typedumper.cli;

import com.typedumper.core.analysis.BinaryAnalyzer;
import com.typedumper.core.dispatch.LayoutSchema;
import com.typedumper.core.dispatch.SortOrder;
import com.typedumper.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available layouts, sort orders, analyzers or output renderers.
 *
 * <p>Analyzers and renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * typedumper list layouts
 * typedumper list sorts
 * typedumper list analyzers
 * typedumper list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available layouts, sort orders, analyzers, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: layouts, sorts, analyzers, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "layouts", "layout" -> listLayouts();
            case "sorts", "sort" -> listSorts();
            case "analyzers", "analyzer" -> listAnalyzers();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: layouts, sorts, analyzers, or renderers", type);
                yield 1;
            }
        };
    }

    private int listLayouts() {
        System.out.println("Available Layouts:");
        System.out.println();
        for (LayoutSchema layout : LayoutSchema.values()) {
            System.out.printf("  • %s%s%n", layout.id(), layout.isOrdered() ? " (sortable)" : "");
        }
        return 0;
    }

    private int listSorts() {
        System.out.println("Available Sort Orders:");
        System.out.println();
        for (SortOrder order : SortOrder.values()) {
            System.out.printf("  • %s%n", order.id());
        }
        return 0;
    }

    private int listAnalyzers() {
        System.out.println("Available Analyzers:");
        System.out.println();

        boolean found = false;
        for (BinaryAnalyzer analyzer : ServiceLoader.load(BinaryAnalyzer.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", analyzer.getDisplayName(), analyzer.getId());
        }

        if (!found) {
            System.out.println("  No analyzers found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Output Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
