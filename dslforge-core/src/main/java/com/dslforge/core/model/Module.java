package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A cohesive group of statements emitted as one target-language function.
 *
 * <p>Modules are created by clustering after validation succeeds and are never
 * changed afterwards.
 *
 * @param name function name, e.g. {@code step_2_fetch_orders}
 * @param statements statements in the module, in source order
 * @param declaredInputs variables the module reads from the workflow context
 * @param declaredOutputs variables the module writes back to the workflow context
 * @param dependsOn names of modules that must run first
 * @param terminal whether the module contains an explicit RETURN
 * @param code synthesized function source
 */
public record Module(
    String name,
    List<Statement> statements,
    List<String> declaredInputs,
    List<String> declaredOutputs,
    List<String> dependsOn,
    boolean terminal,
    String code
) {
    /**
     * Compact constructor with validation.
     */
    public Module {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(code, "code must not be null");
        statements = statements == null ? List.of() : List.copyOf(statements);
        declaredInputs = declaredInputs == null ? List.of() : List.copyOf(declaredInputs);
        declaredOutputs = declaredOutputs == null ? List.of() : List.copyOf(declaredOutputs);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
