package com.dslforge.core.workflow;

import com.dslforge.core.model.Define;
import com.dslforge.core.model.Module;
import com.dslforge.core.naming.IdentifierRules;
import com.dslforge.core.synthesis.CodeSynthesizer;
import com.dslforge.core.synthesis.PythonSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Orders modules and synthesizes the {@code main_workflow} entry point.
 *
 * <p>The entry point keeps all variables in a context dict {@code ctx} built
 * from the caller's input parameters. It then:
 * <ol>
 *   <li>aliases renamed input parameters ({@code ctx.setdefault(new, ctx[original])})</li>
 *   <li>seeds context defaults with {@code ctx.setdefault}</li>
 *   <li>invokes modules in dependency order, passing inputs from {@code ctx}
 *       and storing outputs back into it</li>
 *   <li>returns the value of the first RETURN a terminal module reaches, even
 *       {@code None}; a terminal module that does not return merges its
 *       outputs into {@code ctx}</li>
 *   <li>returns {@code ctx} when no RETURN is reached</li>
 * </ol>
 */
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    /** Name of the synthesized entry point. */
    public static final String ENTRY_POINT = "main_workflow";

    private final CodeSynthesizer synthesizer;

    public WorkflowOrchestrator() {
        this(new CodeSynthesizer());
    }

    public WorkflowOrchestrator(CodeSynthesizer synthesizer) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
    }

    /**
     * Outcome of orchestration.
     *
     * @param ordered modules in invocation order
     * @param entryPoint entry point source, empty when a cycle prevents ordering
     * @param cycle module dependency cycle, if any
     */
    public record Orchestration(List<Module> ordered, String entryPoint, Optional<List<String>> cycle) {
        public Orchestration {
            ordered = List.copyOf(ordered);
            Objects.requireNonNull(entryPoint, "entryPoint must not be null");
            Objects.requireNonNull(cycle, "cycle must not be null");
        }
    }

    /**
     * Orders modules and builds the entry point.
     *
     * @param modules modules in source order
     * @param defaults context defaults
     * @param inputAliases renamed input parameters, new name to original name
     * @return orchestration; {@link Orchestration#cycle()} is present when modules depend on each other
     */
    public Orchestration orchestrate(List<Module> modules, List<Define> defaults, Map<String, String> inputAliases) {
        ModuleOrder.Result order = ModuleOrder.order(modules);
        if (!order.isAcyclic()) {
            log.warn("Module dependency cycle: {}", String.join(" -> ", order.cycle().get()));
            return new Orchestration(order.ordered(), "", order.cycle());
        }
        String entryPoint = entryPoint(order.ordered(), defaults, inputAliases);
        log.debug("Invocation order: {}", order.ordered().stream().map(Module::name).toList());
        return new Orchestration(order.ordered(), entryPoint, Optional.empty());
    }

    private String entryPoint(List<Module> ordered, List<Define> defaults, Map<String, String> inputAliases) {
        String indent = PythonSyntax.indent(1);
        List<String> lines = new ArrayList<>();
        lines.add("def " + ENTRY_POINT + "(input_params: dict):");
        lines.add(indent + "ctx = dict(input_params or {})");

        inputAliases.forEach((sanitized, original) -> {
            lines.add(indent + "if " + PythonSyntax.quote(original) + " in ctx:");
            lines.add(indent + indent + "ctx.setdefault(" + PythonSyntax.quote(sanitized)
                + ", ctx[" + PythonSyntax.quote(original) + "])");
        });

        for (Define define : defaults) {
            String value = define.initialValue() == null ? "None" : synthesizer.expression(define.initialValue());
            lines.add(indent + "ctx.setdefault(" + key(define.name()) + ", " + value + ")");
        }

        for (Module module : ordered) {
            String call = module.name() + "(" + module.declaredInputs().stream()
                .map(input -> "ctx.get(" + key(input) + ")")
                .collect(Collectors.joining(", ")) + ")";
            if (module.terminal()) {
                lines.add(indent + "returned, value = " + call);
                lines.add(indent + "if returned:");
                lines.add(indent + indent + "return value");
                lines.add(indent + "ctx.update(value)");
            } else if (module.declaredOutputs().isEmpty()) {
                lines.add(indent + call);
            } else {
                String targets = module.declaredOutputs().stream()
                    .map(output -> "ctx[" + key(output) + "]")
                    .collect(Collectors.joining(", "));
                lines.add(indent + targets + " = " + call);
            }
        }

        lines.add(indent + "return ctx");
        return String.join("\n", lines);
    }

    private static String key(String name) {
        return PythonSyntax.quote(IdentifierRules.sanitize(name));
    }
}
