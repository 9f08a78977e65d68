package com.dslforge.core.analysis;

import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DependencyGraph;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.VarType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tables built by {@link SymbolAnalyzer}.
 *
 * @param definitionTable variable name to its first defining span, in definition order
 * @param declaredTypes declared type per known variable, from DEFINE or the upstream list
 * @param usages every referenced variable name, in first-use order
 * @param loopVariables names bound by FOR loops
 * @param callGraph call graph
 * @param defects duplicate, undefined and cyclic defects, sorted by position
 */
public record AnalysisResult(
    Map<String, SourceSpan> definitionTable,
    Map<String, VarType> declaredTypes,
    Set<String> usages,
    Set<String> loopVariables,
    DependencyGraph callGraph,
    List<Defect> defects
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(definitionTable, "definitionTable must not be null");
        Objects.requireNonNull(declaredTypes, "declaredTypes must not be null");
        Objects.requireNonNull(usages, "usages must not be null");
        Objects.requireNonNull(loopVariables, "loopVariables must not be null");
        Objects.requireNonNull(callGraph, "callGraph must not be null");
        Objects.requireNonNull(defects, "defects must not be null");
        definitionTable = Collections.unmodifiableMap(new LinkedHashMap<>(definitionTable));
        declaredTypes = Collections.unmodifiableMap(new LinkedHashMap<>(declaredTypes));
        usages = Collections.unmodifiableSet(new LinkedHashSet<>(usages));
        loopVariables = Collections.unmodifiableSet(new LinkedHashSet<>(loopVariables));
        defects = List.copyOf(defects);
    }

    /**
     * Returns the declared type of a variable.
     *
     * @param name variable name
     * @return type, or empty when the variable is unknown
     */
    public Optional<VarType> typeOf(String name) {
        return Optional.ofNullable(declaredTypes.get(name));
    }
}
