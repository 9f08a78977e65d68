package com.dslforge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DslForgeCLI}.
 */
class DslForgeCLITest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = DslForgeCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void help_listsAllSubcommands() {
        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("transpile", "validate", "repair", "list");
    }

    @Test
    void version_printsVersion() {
        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("DslForge 1.0.0-SNAPSHOT");
    }

    @Test
    void unknownSubcommand_returnsUsageError() {
        int exitCode = commandLine.execute("compile", "x.dsl");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("compile");
    }

    @Test
    void quietFlag_isAcceptedBeforeSubcommand() {
        int exitCode = commandLine.execute("-q", "list", "strategies");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("hybrid");
    }
}
