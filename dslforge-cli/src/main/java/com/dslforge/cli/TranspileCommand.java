package com.dslforge.cli;

import com.dslforge.core.Transpiler;
import com.dslforge.core.config.ConfigLoader;
import com.dslforge.core.config.ForgeConfig;
import com.dslforge.core.correction.TranspileRequest;
import com.dslforge.core.history.AttemptLogWriter;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.TranspileResult;
import com.dslforge.core.renderer.GeneratedOutput;
import com.dslforge.core.renderer.OutputRenderer;
import com.dslforge.core.renderer.RenderContext;
import com.dslforge.core.workflow.ClusteringStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to run a full transpile session.
 *
 * <p>Orchestrates the pipeline:
 * <ol>
 *   <li>Load configuration and upstream variables</li>
 *   <li>Run the self-correction loop on the DSL file</li>
 *   <li>Write the attempt log when history is enabled</li>
 *   <li>Render the generated program to the output directory or the console</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dslforge transpile workflow.dsl --variables vars.yaml
 * dslforge transpile workflow.dsl --strategy io-isolation --console
 * dslforge transpile workflow.dsl --dry-run
 * }</pre>
 *
 * <p>Exit code 0 on success, 1 when the session fails; every unresolved defect
 * is printed.
 */
@Command(
    name = "transpile",
    description = "Transpile a DSL file into a Python workflow",
    mixinStandardHelpOptions = true
)
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "DSL file to transpile")
    private Path dslFile;

    @Option(names = {"--variables"}, description = "Upstream variables file (YAML or JSON)")
    private Path variablesFile;

    @Option(names = {"--requirement"}, description = "Natural-language requirement, sent with regeneration requests")
    private String requirement;

    @Option(names = {"--strategy"}, description = "Clustering strategy: io-isolation, control-flow, hybrid (overrides config)")
    private String strategy;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: dslforge.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--session-id"}, description = "Session id (default: random UUID)")
    private String sessionId;

    @Option(names = {"--dry-run"}, description = "Run the session but write no files")
    private boolean dryRun;

    @Option(names = {"--console"}, description = "Print the generated program instead of writing it")
    private boolean console;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ForgeConfig config = ConfigLoader.load(configPath);
            String strategyName = strategy != null ? strategy : config.transpiler().strategy();
            ClusteringStrategy clustering = ClusteringStrategy.fromName(strategyName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown clustering strategy: " + strategyName));

            TranspileRequest request = new TranspileRequest(sessionId, CommandInputs.readDsl(dslFile), requirement,
                CommandInputs.readVariables(variablesFile), clustering);
            out.println("Transpiling " + dslFile + " (session " + request.sessionId() + ")");

            TranspileResult result = Transpiler.fromConfig(config).transpile(request);

            if (!dryRun && config.history().enabled()) {
                Path logFile = new AttemptLogWriter(Paths.get(config.history().directory())).write(result);
                out.println("✓ Attempt log: " + logFile);
            }

            if (!result.isSuccess()) {
                err.println("✗ Transpile failed after " + result.attemptsUsed() + " attempts ("
                    + result.failureReason() + "), " + result.defects().size() + " defects remain:");
                CommandInputs.printDefects(err, result.defects());
                return 1;
            }

            out.println("✓ Transpiled in " + result.attemptsUsed() + " attempts: "
                + result.modules().size() + " modules");
            for (Module module : result.modules()) {
                out.println("  • " + module.name() + (module.dependsOn().isEmpty() ? "" : " after " + module.dependsOn()));
            }
            CommandInputs.printDefects(out, result.defects());

            if (dryRun) {
                out.println("Dry-run mode: skipping output rendering");
                return 0;
            }

            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            OutputRenderer renderer = renderer(console ? "console" : "filesystem");
            renderer.render(GeneratedOutput.of(result, config.output().fileName()),
                new RenderContext(directory, Map.of()));
            if (!console) {
                out.println("✓ Wrote " + Paths.get(directory).resolve(config.output().fileName()));
            }
            return 0;
        } catch (Exception e) {
            log.error("Transpile failed", e);
            err.println("✗ Transpile failed: " + e.getMessage());
            return 1;
        }
    }

    private static OutputRenderer renderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Renderer not found: " + id);
    }
}
