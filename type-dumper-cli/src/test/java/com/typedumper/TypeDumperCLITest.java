package com.typedumper;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TypeDumperCLI}.
 */
class TypeDumperCLITest {

    @Test
    void commandLine_registersSubcommands() {
        CommandLine commandLine = TypeDumperCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsKeys("dump", "resolve", "list");
    }

    @Test
    void execute_withGlobalOptionsBeforeSubcommand_runsSubcommand() {
        assertThat(TypeDumperCLI.commandLine().execute("-q", "list", "sorts")).isZero();
        assertThat(TypeDumperCLI.commandLine().execute("-v", "list", "unknown")).isEqualTo(1);
    }

    @Test
    void execute_withoutSubcommand_printsBanner() {
        assertThat(TypeDumperCLI.commandLine().execute()).isZero();
    }

    @Test
    void parse_setsGlobalFlags() {
        TypeDumperCLI cli = new TypeDumperCLI();
        new CommandLine(cli).parseArgs("--verbose");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }
}
