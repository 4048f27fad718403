package com.typedumper.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    @Test
    void list_layouts_printsEveryLayout() {
        int exitCode = new CommandLine(new ListCommand()).execute("layouts");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("single (sortable)", "namespace", "assembly", "class", "tree");
    }

    @Test
    void list_sorts_printsEverySortOrder() {
        int exitCode = new CommandLine(new ListCommand()).execute("sorts");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("index", "name");
    }

    @Test
    void list_analyzers_printsDiscoveredAnalyzers() {
        int exitCode = new CommandLine(new ListCommand()).execute("analyzers");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Type Manifest Analyzer (ID: manifest)");
    }

    @Test
    void list_renderers_printsDiscoveredRenderers() {
        int exitCode = new CommandLine(new ListCommand()).execute("renderers");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("filesystem");
    }

    @Test
    void list_unknownType_returnsOne() {
        assertThat(new CommandLine(new ListCommand()).execute("widgets")).isEqualTo(1);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }
}
