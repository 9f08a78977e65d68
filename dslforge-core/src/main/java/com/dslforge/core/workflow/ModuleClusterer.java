package com.dslforge.core.workflow;

import com.dslforge.core.analysis.StatementWalker;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.DependencyGraph;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.Module;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.ValueExpression;
import com.dslforge.core.naming.IdentifierRules;
import com.dslforge.core.synthesis.CodeSynthesizer;
import com.dslforge.core.synthesis.ReturnAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partitions validated top-level statements into modules.
 *
 * <p>Top-level {@code DEFINE}s with a literal (or no) initial value are not put
 * into any module: they become context defaults seeded by the entry point (see
 * {@link #contextDefaults(List)}). The remaining statements are partitioned
 * according to the {@link ClusteringStrategy}; statements the strategy does not
 * isolate are grouped with their consecutive neighbours.
 *
 * <h2>Inputs and outputs</h2>
 * <p>A module's inputs are the variables it reads before writing them, plus the
 * variables it writes only conditionally (inside a branch or loop), so that the
 * previous value survives when the branch is skipped. Its outputs are every
 * variable it writes except loop variables. A module containing a RETURN is
 * terminal: it reports whether a RETURN was reached, and when none was, its
 * outputs flow on to later modules like any other module's.
 *
 * <h2>Dependencies</h2>
 * <p>A module depends on the latest earlier module that outputs one of its
 * inputs. It also depends on a module calling {@code f} when it calls a
 * function {@code g} with a call-graph edge {@code g -> f}: the latest earlier
 * such module, or the first later one when none precedes it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModuleClusterer clusterer = new ModuleClusterer();
 * List<Module> modules = clusterer.cluster(statements, analysis.callGraph(), ClusteringStrategy.HYBRID);
 * }</pre>
 */
public class ModuleClusterer {

    private static final Logger log = LoggerFactory.getLogger(ModuleClusterer.class);

    private final CodeSynthesizer synthesizer;

    public ModuleClusterer() {
        this(new CodeSynthesizer());
    }

    public ModuleClusterer(CodeSynthesizer synthesizer) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
    }

    /**
     * Partitions statements into modules, in source order.
     *
     * @param statements validated top-level statements
     * @param callGraph call graph from analysis
     * @param strategy clustering strategy
     * @return modules with inputs, outputs, dependencies and synthesized code
     */
    public List<Module> cluster(List<Statement> statements, DependencyGraph callGraph, ClusteringStrategy strategy) {
        Objects.requireNonNull(statements, "statements must not be null");
        Objects.requireNonNull(callGraph, "callGraph must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");

        List<List<Statement>> groups = partition(statements, strategy);
        List<Draft> drafts = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            drafts.add(Draft.of(i + 1, groups.get(i)));
        }

        List<Module> modules = new ArrayList<>();
        for (int i = 0; i < drafts.size(); i++) {
            Draft draft = drafts.get(i);
            List<String> dependsOn = dependenciesOf(i, drafts, callGraph);
            String code = draft.terminal
                ? synthesizer.terminalFunction(draft.name, draft.inputs, draft.statements, draft.outputs)
                : synthesizer.function(draft.name, draft.inputs, draft.statements, draft.outputs);
            modules.add(new Module(draft.name, draft.statements, draft.inputs, draft.outputs,
                dependsOn, draft.terminal, code));
            log.debug("Module {}: inputs={}, outputs={}, dependsOn={}", draft.name, draft.inputs, draft.outputs, dependsOn);
        }
        log.info("Clustered {} statements into {} modules using {}", statements.size(), modules.size(), strategy);
        return modules;
    }

    /**
     * Returns the top-level definitions seeded into the workflow context instead
     * of being placed in a module.
     *
     * @param statements top-level statements
     * @return definitions with a literal or absent initial value, in source order
     */
    public List<Define> contextDefaults(List<Statement> statements) {
        List<Define> defaults = new ArrayList<>();
        for (Statement statement : statements) {
            if (isContextDefault(statement)) {
                defaults.add((Define) statement);
            }
        }
        return defaults;
    }

    static boolean isContextDefault(Statement statement) {
        if (!(statement instanceof Define define)) {
            return false;
        }
        Expression value = define.initialValue();
        return value == null || (value instanceof ValueExpression literal && literal.isLiteral());
    }

    private static List<List<Statement>> partition(List<Statement> statements, ClusteringStrategy strategy) {
        List<List<Statement>> groups = new ArrayList<>();
        List<Statement> pending = new ArrayList<>();
        for (Statement statement : statements) {
            if (isContextDefault(statement)) {
                continue;
            }
            if (isolates(statement, strategy)) {
                if (!pending.isEmpty()) {
                    groups.add(pending);
                    pending = new ArrayList<>();
                }
                groups.add(List.of(statement));
            } else {
                pending.add(statement);
            }
        }
        if (!pending.isEmpty()) {
            groups.add(pending);
        }
        return groups;
    }

    private static boolean isolates(Statement statement, ClusteringStrategy strategy) {
        if (ReturnAnalysis.containsReturn(List.of(statement))) {
            return true;
        }
        boolean block = statement instanceof IfStatement || statement instanceof ForStatement;
        return switch (strategy) {
            case IO_ISOLATION -> !callsOf(List.of(statement)).isEmpty();
            case CONTROL_FLOW -> block;
            case HYBRID -> block || !callsOf(List.of(statement)).isEmpty();
        };
    }

    private static List<String> dependenciesOf(int index, List<Draft> drafts, DependencyGraph callGraph) {
        Draft module = drafts.get(index);
        Set<Integer> dependencies = new TreeSet<>();

        for (String input : module.inputs) {
            for (int j = index - 1; j >= 0; j--) {
                if (drafts.get(j).outputs.contains(input)) {
                    dependencies.add(j);
                    break;
                }
            }
        }

        for (String caller : module.calls) {
            for (String callee : callGraph.successors(caller)) {
                int provider = providerOf(callee, index, drafts);
                if (provider >= 0) {
                    dependencies.add(provider);
                }
            }
        }

        dependencies.remove(index);
        return dependencies.stream().map(j -> drafts.get(j).name).toList();
    }

    private static int providerOf(String function, int index, List<Draft> drafts) {
        for (int j = index - 1; j >= 0; j--) {
            if (drafts.get(j).calls.contains(function)) {
                return j;
            }
        }
        for (int j = index + 1; j < drafts.size(); j++) {
            if (drafts.get(j).calls.contains(function)) {
                return j;
            }
        }
        return -1;
    }

    private static List<String> callsOf(List<Statement> statements) {
        List<String> calls = new ArrayList<>();
        for (Statement statement : StatementWalker.flatten(statements)) {
            for (Expression expression : StatementWalker.expressionsOf(statement)) {
                for (CallExpression call : StatementWalker.callsIn(expression)) {
                    calls.add(call.functionName());
                }
            }
        }
        return calls;
    }

    private record Draft(
        String name,
        List<Statement> statements,
        List<String> inputs,
        List<String> outputs,
        Set<String> calls,
        boolean terminal
    ) {
        static Draft of(int position, List<Statement> statements) {
            LinkedHashSet<String> inputs = new LinkedHashSet<>();
            Set<String> written = new HashSet<>();
            collectInputs(statements, written, Set.of(), inputs);

            boolean terminal = ReturnAnalysis.containsReturn(statements);
            LinkedHashSet<String> outputs = new LinkedHashSet<>();
            for (Statement statement : StatementWalker.flatten(statements)) {
                String name = StatementWalker.writtenName(statement);
                if (name != null && !(statement instanceof ForStatement)) {
                    outputs.add(name);
                }
            }
            for (String output : outputs) {
                if (!written.contains(output)) {
                    inputs.add(output);
                }
            }

            List<String> calls = callsOf(statements);
            String name = "step_" + position + "_" + suffix(calls, outputs);
            return new Draft(name, statements, List.copyOf(inputs), List.copyOf(outputs),
                new LinkedHashSet<>(calls), terminal);
        }

        private static void collectInputs(List<Statement> statements, Set<String> written,
                                          Set<String> loopVariables, Set<String> inputs) {
            for (Statement statement : statements) {
                for (Expression expression : StatementWalker.expressionsOf(statement)) {
                    for (String reference : expression.references()) {
                        if (!written.contains(reference) && !loopVariables.contains(reference)) {
                            inputs.add(reference);
                        }
                    }
                }
                if (statement instanceof ForStatement forStatement) {
                    Set<String> bound = new HashSet<>(loopVariables);
                    bound.add(forStatement.loopVar());
                    collectInputs(forStatement.body(), new HashSet<>(written), bound, inputs);
                } else if (statement instanceof IfStatement) {
                    for (List<Statement> block : StatementWalker.children(statement)) {
                        collectInputs(block, new HashSet<>(written), loopVariables, inputs);
                    }
                } else {
                    String name = StatementWalker.writtenName(statement);
                    if (name != null) {
                        written.add(name);
                    }
                }
            }
        }

        private static String suffix(List<String> calls, Set<String> outputs) {
            if (!calls.isEmpty()) {
                return IdentifierRules.sanitize(calls.get(0));
            }
            if (!outputs.isEmpty()) {
                return "compute_" + IdentifierRules.sanitize(outputs.iterator().next());
            }
            return "process";
        }
    }
}
