package com.dslforge.cli;

import com.dslforge.core.Transpiler;
import com.dslforge.core.correction.LoopSettings;
import com.dslforge.core.generation.impl.DisabledGenerationService;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.parser.DslPrinter;
import com.dslforge.core.repair.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to apply one deterministic repair pass and print the repaired DSL.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dslforge repair workflow.dsl
 * dslforge repair workflow.dsl -o workflow.fixed.dsl
 * }</pre>
 */
@Command(
    name = "repair",
    description = "Apply deterministic repairs to a DSL file",
    mixinStandardHelpOptions = true
)
public class RepairCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RepairCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "DSL file to repair")
    private Path dslFile;

    @Option(names = {"--variables"}, description = "Upstream variables file (YAML or JSON)")
    private Path variablesFile;

    @Option(names = {"-o", "--output"}, description = "Write the repaired DSL to this file instead of stdout")
    private Path outputFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            log.info("Repairing: {}", dslFile);
            Transpiler transpiler = new Transpiler(new DisabledGenerationService(), LoopSettings.defaults());
            RepairResult result = transpiler.repairOnce(CommandInputs.readDsl(dslFile),
                CommandInputs.readVariables(variablesFile));
            String repaired = new DslPrinter().print(result.statements());

            if (outputFile != null) {
                Files.writeString(outputFile, repaired, StandardCharsets.UTF_8);
                out.println("✓ Wrote repaired DSL to " + outputFile);
            } else {
                out.println(repaired);
            }

            if (result.madeProgress()) {
                out.println("✓ Fixed: " + result.fixedKinds().stream()
                    .map(DefectKind::getDisplayName).collect(Collectors.joining(", ")));
            } else {
                out.println("• Nothing to fix deterministically");
            }
            result.identifierMapping().forEach((sanitized, original) ->
                out.println("  renamed " + original + " -> " + sanitized));

            long fatal = result.remaining().stream().filter(Defect::isFatal).count();
            if (!result.remaining().isEmpty()) {
                PrintWriter target = fatal > 0 ? err : out;
                target.println((fatal > 0 ? "✗ " : "✓ ") + result.remaining().size() + " defects remain");
                CommandInputs.printDefects(target, result.remaining());
            }
            return fatal > 0 ? 1 : 0;
        } catch (Exception e) {
            log.error("Repair failed", e);
            err.println("✗ Repair failed: " + e.getMessage());
            return 1;
        }
    }
}
