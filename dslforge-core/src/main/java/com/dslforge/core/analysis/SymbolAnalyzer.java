package com.dslforge.core.analysis;

import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallArgument;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.DependencyGraph;
import com.dslforge.core.model.ElifBranch;
import com.dslforge.core.model.Expression;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.VarType;
import com.dslforge.core.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the definition table, usage set and call graph of a statement tree and
 * reports duplicate definitions, undefined variables and call cycles.
 *
 * <h2>Call graph</h2>
 * <p>{@link DependencyGraph#ROOT} calls every function called outside another
 * call's arguments. A function {@code g} calls {@code f} when a call to
 * {@code f} sits inside the arguments of a call to {@code g}, or when an
 * argument of {@code g} reads a variable whose value, at that point in the
 * program, can come (directly or through assignments and loops) from a call
 * to {@code f}. Reassigning a variable outside any branch replaces where its
 * value comes from; writes inside branches and loops add to it.
 *
 * <p>The analyzer is stateless: every call works on its own tables, so one
 * instance can serve concurrent sessions.
 */
public class SymbolAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SymbolAnalyzer.class);

    /**
     * Analyzes a statement tree against the upstream variable list.
     *
     * @param statements parsed statements
     * @param upstream variables supplied by upstream extraction
     * @return tables and defects
     */
    public AnalysisResult analyze(List<Statement> statements, List<Variable> upstream) {
        Tables tables = new Tables();
        registerUpstream(upstream, tables);
        StatementWalker.forEach(statements, statement -> collect(statement, tables));
        reportUndefined(tables);

        DependencyGraph graph = buildCallGraph(statements, tables);
        reportCycles(graph, tables);

        tables.defects.sort(null);
        log.debug("Analysis found {} definitions, {} usages, {} functions, {} defects",
            tables.definitions.size(), tables.firstUse.size(), graph.functions().size(), tables.defects.size());
        return new AnalysisResult(tables.definitions, tables.types, tables.firstUse.keySet(),
            tables.loopVariables, graph, tables.defects);
    }

    private void registerUpstream(List<Variable> upstream, Tables tables) {
        for (Variable variable : upstream) {
            if (!tables.upstreamNames.add(variable.name())) {
                tables.defects.add(Defect.of(DefectKind.DUPLICATE_DEFINITION, SourceSpan.UPSTREAM, variable.name(),
                    "Upstream variable '" + variable.name() + "' is supplied more than once"));
                continue;
            }
            tables.types.put(variable.name(), variable.type());
        }
    }

    private void collect(Statement statement, Tables tables) {
        if (statement instanceof Define define) {
            SourceSpan first = tables.definitions.get(define.name());
            if (first != null) {
                tables.defects.add(Defect.of(DefectKind.DUPLICATE_DEFINITION, define.span(), define.name(),
                    "Variable '" + define.name() + "' is already defined at line " + first.line()));
            } else {
                tables.definitions.put(define.name(), define.span());
                if (define.type() != VarType.ANY || !tables.types.containsKey(define.name())) {
                    tables.types.put(define.name(), define.type());
                }
            }
        } else if (statement instanceof Assign assign) {
            tables.use(assign.target(), assign.span());
        } else if (statement instanceof CallStatement call && call.hasResultBinding()) {
            tables.use(call.resultBinding(), call.span());
        } else if (statement instanceof ForStatement forStatement) {
            tables.loopVariables.add(forStatement.loopVar());
        }

        for (Expression expression : StatementWalker.expressionsOf(statement)) {
            expression.references().forEach(name -> tables.use(name, statement.span()));
        }
    }

    private void reportUndefined(Tables tables) {
        tables.firstUse.forEach((name, span) -> {
            boolean known = tables.definitions.containsKey(name)
                || tables.upstreamNames.contains(name)
                || tables.loopVariables.contains(name);
            if (!known) {
                tables.defects.add(Defect.of(DefectKind.UNDEFINED_VARIABLE, span, name,
                    "Variable '" + name + "' is used but never defined"));
            }
        });
    }

    private DependencyGraph buildCallGraph(List<Statement> statements, Tables tables) {
        DependencyGraph.Builder builder = new DependencyGraph.Builder();
        walk(statements, new HashMap<>(), builder, tables);
        return builder.build();
    }

    /**
     * Walks a block in source order, adding call edges and tracking which
     * functions each variable's current value can come from.
     *
     * <p>A write outside any branch replaces the variable's producers. Branch
     * and loop bodies work on copies that are merged back by union, so a
     * conditional write only ever adds producers.
     *
     * @return producers after the block
     */
    private Map<String, Set<String>> walk(List<Statement> statements, Map<String, Set<String>> producers,
                                          DependencyGraph.Builder builder, Tables tables) {
        Map<String, Set<String>> state = copy(producers);
        for (Statement statement : statements) {
            for (Expression expression : StatementWalker.expressionsOf(statement)) {
                if (expression instanceof CallExpression call) {
                    addCall(DependencyGraph.ROOT, call, statement.span(), state, builder, tables);
                }
            }

            if (statement instanceof Define define) {
                state.put(define.name(), define.initialValue() == null
                    ? new LinkedHashSet<>()
                    : producersOf(define.initialValue(), state));
            } else if (statement instanceof Assign assign) {
                state.put(assign.target(), producersOf(assign.expression(), state));
            } else if (statement instanceof CallStatement call && call.hasResultBinding()) {
                state.put(call.resultBinding(), new LinkedHashSet<>(Set.of(call.call().functionName())));
            } else if (statement instanceof IfStatement ifStatement) {
                Map<String, Set<String>> merged = ifStatement.hasElse() ? new HashMap<>() : copy(state);
                merge(merged, walk(ifStatement.thenBranch(), state, builder, tables));
                for (ElifBranch elif : ifStatement.elifBranches()) {
                    merge(merged, walk(elif.body(), state, builder, tables));
                }
                if (ifStatement.hasElse()) {
                    merge(merged, walk(ifStatement.elseBranch(), state, builder, tables));
                }
                state = merged;
            } else if (statement instanceof ForStatement forStatement) {
                state = walkLoop(forStatement, state, builder, tables);
            }
        }
        return state;
    }

    private Map<String, Set<String>> walkLoop(ForStatement forStatement, Map<String, Set<String>> before,
                                              DependencyGraph.Builder builder, Tables tables) {
        Set<String> elementProducers = producersOf(forStatement.iterable(), before);
        Map<String, Set<String>> entry = copy(before);
        while (true) {
            entry.put(forStatement.loopVar(), new LinkedHashSet<>(elementProducers));
            Map<String, Set<String>> next = copy(entry);
            merge(next, walk(forStatement.body(), entry, builder, tables));
            if (next.equals(entry)) {
                break;
            }
            entry = next;
        }
        // Zero iterations leave the incoming values in place.
        Map<String, Set<String>> after = copy(before);
        merge(after, entry);
        return after;
    }

    private static Set<String> producersOf(Expression expression, Map<String, Set<String>> state) {
        Set<String> result = new LinkedHashSet<>();
        if (expression instanceof CallExpression call) {
            result.add(call.functionName());
            return result;
        }
        for (String name : expression.references()) {
            result.addAll(state.getOrDefault(name, Set.of()));
        }
        return result;
    }

    private static Map<String, Set<String>> copy(Map<String, Set<String>> state) {
        Map<String, Set<String>> copy = new HashMap<>();
        state.forEach((name, producers) -> copy.put(name, new LinkedHashSet<>(producers)));
        return copy;
    }

    private static void merge(Map<String, Set<String>> into, Map<String, Set<String>> from) {
        from.forEach((name, producers) -> into.computeIfAbsent(name, key -> new LinkedHashSet<>()).addAll(producers));
    }

    private void addCall(String caller, CallExpression call, SourceSpan span,
                         Map<String, Set<String>> producers, DependencyGraph.Builder builder, Tables tables) {
        String callee = call.functionName();
        builder.edge(caller, callee);
        tables.firstCall.putIfAbsent(callee, span);

        for (CallArgument argument : call.arguments()) {
            if (argument.value() instanceof CallExpression nested) {
                addCall(callee, nested, span, producers, builder, tables);
                continue;
            }
            for (String name : argument.value().references()) {
                for (String producer : producers.getOrDefault(name, Set.of())) {
                    builder.edge(callee, producer);
                }
            }
        }
    }

    private void reportCycles(DependencyGraph graph, Tables tables) {
        for (List<String> cycle : CycleDetector.findCycles(graph)) {
            String path = String.join(" -> ", cycle);
            SourceSpan span = tables.firstCall.getOrDefault(cycle.get(0), SourceSpan.SYNTHETIC);
            tables.defects.add(Defect.of(DefectKind.CYCLIC_DEPENDENCY, span, path,
                "Call cycle: " + path));
        }
    }

    /**
     * Working tables of one {@link #analyze} call.
     */
    private static final class Tables {
        private final Map<String, SourceSpan> definitions = new LinkedHashMap<>();
        private final Map<String, VarType> types = new LinkedHashMap<>();
        private final Map<String, SourceSpan> firstUse = new LinkedHashMap<>();
        private final Map<String, SourceSpan> firstCall = new HashMap<>();
        private final Set<String> upstreamNames = new LinkedHashSet<>();
        private final Set<String> loopVariables = new LinkedHashSet<>();
        private final List<Defect> defects = new ArrayList<>();

        void use(String name, SourceSpan span) {
            firstUse.putIfAbsent(name, span);
        }
    }
}
