package com.dslforge.cli;

import com.dslforge.core.generation.GenerationService;
import com.dslforge.core.generation.GenerationServiceFactory;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.workflow.ClusteringStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list clustering strategies, generation providers or defect kinds.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dslforge list strategies
 * dslforge list providers
 * dslforge list defects
 * }</pre>
 */
@Command(
    name = "list",
    description = "List clustering strategies, generation providers, or defect kinds",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: strategies, providers, or defects")
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "strategies", "strategy" -> listStrategies(out);
            case "providers", "provider" -> listProviders(out);
            case "defects", "defect" -> listDefects(out);
            default -> {
                log.error("Unknown type: {}. Use: strategies, providers, or defects", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type);
                yield 1;
            }
        };
    }

    private int listStrategies(PrintWriter out) {
        out.println("Clustering Strategies:");
        out.println();
        for (ClusteringStrategy strategy : ClusteringStrategy.values()) {
            out.printf("  • %s%n", strategy.getCliName());
        }
        return 0;
    }

    private int listProviders(PrintWriter out) {
        out.println("Generation Providers:");
        out.println();
        for (GenerationService service : GenerationServiceFactory.discover()) {
            out.printf("  • %s (ID: %s)%n", service.getDisplayName(), service.getId());
        }
        return 0;
    }

    private int listDefects(PrintWriter out) {
        out.println("Defect Kinds:");
        out.println();
        for (DefectKind kind : DefectKind.values()) {
            out.printf("  • %s (%s)%n", kind.getDisplayName(), kind.getSeverity());
        }
        return 0;
    }
}
