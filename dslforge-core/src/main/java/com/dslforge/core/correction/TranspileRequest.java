package com.dslforge.core.correction;

import com.dslforge.core.model.Variable;
import com.dslforge.core.workflow.ClusteringStrategy;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Input of one transpile session.
 *
 * @param sessionId session identifier, used to key the attempt log
 * @param dslText initial DSL draft
 * @param requirement natural-language requirement the draft implements; sent with regeneration requests
 * @param variables resolved upstream variables
 * @param strategy clustering strategy
 */
public record TranspileRequest(
    String sessionId,
    String dslText,
    String requirement,
    List<Variable> variables,
    ClusteringStrategy strategy
) {
    /**
     * Compact constructor with validation.
     */
    public TranspileRequest {
        Objects.requireNonNull(dslText, "dslText must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        sessionId = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        requirement = requirement == null ? "" : requirement;
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    /**
     * Creates a request with a random session id, no requirement and hybrid clustering.
     *
     * @param dslText DSL draft
     * @param variables upstream variables
     * @return request
     */
    public static TranspileRequest of(String dslText, List<Variable> variables) {
        return new TranspileRequest(null, dslText, null, variables, ClusteringStrategy.HYBRID);
    }
}
