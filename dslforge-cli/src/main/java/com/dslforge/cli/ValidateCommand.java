package com.dslforge.cli;

import com.dslforge.core.Transpiler;
import com.dslforge.core.correction.LoopSettings;
import com.dslforge.core.generation.impl.DisabledGenerationService;
import com.dslforge.core.model.Defect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to report every defect of a DSL file without repairing it.
 *
 * <p>Exit code 0 when no fatal defect exists (warnings are allowed), 1 otherwise.
 */
@Command(
    name = "validate",
    description = "Parse, analyze and validate a DSL file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "DSL file to validate")
    private Path dslFile;

    @Option(names = {"--variables"}, description = "Upstream variables file (YAML or JSON)")
    private Path variablesFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            log.info("Validating: {}", dslFile);
            Transpiler transpiler = new Transpiler(new DisabledGenerationService(), LoopSettings.defaults());
            List<Defect> defects = transpiler.check(CommandInputs.readDsl(dslFile),
                CommandInputs.readVariables(variablesFile));

            long fatal = defects.stream().filter(Defect::isFatal).count();
            if (defects.isEmpty()) {
                out.println("✓ " + dslFile + ": no defects");
                return 0;
            }
            PrintWriter target = fatal > 0 ? err : out;
            target.println((fatal > 0 ? "✗ " : "✓ ") + dslFile + ": " + fatal + " errors, "
                + (defects.size() - fatal) + " warnings");
            CommandInputs.printDefects(target, defects);
            return fatal > 0 ? 1 : 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
