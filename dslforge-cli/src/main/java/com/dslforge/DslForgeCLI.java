package com.dslforge;

import ch.qos.logback.classic.Level;
import com.dslforge.cli.ListCommand;
import com.dslforge.cli.RepairCommand;
import com.dslforge.cli.TranspileCommand;
import com.dslforge.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DslForge.
 *
 * <p>DslForge turns workflow pseudocode (DEFINE / CALL / IF / FOR / RETURN)
 * into a validated, modular Python program, repairing defects locally and
 * asking a text-generation service for a new draft when local repair is not
 * enough.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code transpile} - Run a full session and write the generated program</li>
 *   <li>{@code validate} - Report every defect of a DSL file</li>
 *   <li>{@code repair} - Apply one deterministic repair pass</li>
 *   <li>{@code list} - List clustering strategies, generation providers or defect kinds</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * dslforge validate workflow.dsl --variables vars.yaml
 * dslforge transpile workflow.dsl --variables vars.yaml --strategy control-flow -o ./out
 * dslforge list strategies
 * }</pre>
 */
@Command(
    name = "dslforge",
    mixinStandardHelpOptions = true,
    version = "DslForge 1.0.0-SNAPSHOT",
    description = "Self-correcting transpiler from workflow pseudocode to Python",
    subcommands = {
        TranspileCommand.class,
        ValidateCommand.class,
        RepairCommand.class,
        ListCommand.class
    }
)
public class DslForgeCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("DslForge - Self-correcting DSL to Python transpiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'dslforge --help' to see available commands");
        System.out.println("Use 'dslforge <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options. Runs before any subcommand.
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
    }

    /**
     * Creates the command line with logging configured before execution.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        DslForgeCLI cli = new DslForgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
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
