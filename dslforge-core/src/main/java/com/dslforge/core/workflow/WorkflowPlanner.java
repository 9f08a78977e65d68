package com.dslforge.core.workflow;

import com.dslforge.core.model.Define;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.DependencyGraph;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs clustering, ordering, orchestration and program emission for a
 * validator-clean statement list.
 *
 * <p>A module-level dependency cycle is returned as a
 * {@link DefectKind#CYCLIC_DEPENDENCY} defect instead of a plan, so the caller
 * can treat it like any other unresolved defect.
 */
public class WorkflowPlanner {

    private final ModuleClusterer clusterer;
    private final WorkflowOrchestrator orchestrator;
    private final ProgramEmitter emitter;

    public WorkflowPlanner() {
        this(new ModuleClusterer(), new WorkflowOrchestrator(), new ProgramEmitter());
    }

    public WorkflowPlanner(ModuleClusterer clusterer, WorkflowOrchestrator orchestrator, ProgramEmitter emitter) {
        this.clusterer = Objects.requireNonNull(clusterer, "clusterer must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
    }

    /**
     * Result of planning.
     *
     * @param modules modules in invocation order
     * @param entryPoint entry point source
     * @param program complete program source
     * @param cycleDefect module cycle defect; when present the other fields are empty
     */
    public record Plan(List<Module> modules, String entryPoint, String program, Optional<Defect> cycleDefect) {
        public Plan {
            modules = List.copyOf(modules);
            Objects.requireNonNull(entryPoint, "entryPoint must not be null");
            Objects.requireNonNull(program, "program must not be null");
            Objects.requireNonNull(cycleDefect, "cycleDefect must not be null");
        }

        public boolean isComplete() {
            return cycleDefect.isEmpty();
        }
    }

    /**
     * Plans the workflow.
     *
     * @param statements validator-clean statements
     * @param callGraph call graph of the statements
     * @param strategy clustering strategy
     * @param inputAliases renamed input parameters, new name to original name
     * @param title program title
     * @return plan, or a cycle defect
     */
    public Plan plan(List<Statement> statements, DependencyGraph callGraph, ClusteringStrategy strategy,
                     Map<String, String> inputAliases, String title) {
        List<Module> modules = clusterer.cluster(statements, callGraph, strategy);
        List<Define> defaults = clusterer.contextDefaults(statements);
        WorkflowOrchestrator.Orchestration orchestration = orchestrator.orchestrate(modules, defaults, inputAliases);

        if (orchestration.cycle().isPresent()) {
            List<String> cycle = orchestration.cycle().get();
            SourceSpan span = modules.stream()
                .filter(module -> module.name().equals(cycle.get(0)))
                .findFirst()
                .flatMap(module -> module.statements().stream().findFirst())
                .map(Statement::span)
                .orElse(SourceSpan.SYNTHETIC);
            String subject = String.join(" -> ", cycle);
            Defect defect = Defect.of(DefectKind.CYCLIC_DEPENDENCY, span, subject,
                "Modules depend on each other: " + subject);
            return new Plan(List.of(), "", "", Optional.of(defect));
        }

        String program = emitter.emit(title, orchestration.ordered(), orchestration.entryPoint());
        return new Plan(orchestration.ordered(), orchestration.entryPoint(), program, Optional.empty());
    }
}
