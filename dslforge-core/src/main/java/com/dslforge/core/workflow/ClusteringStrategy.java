package com.dslforge.core.workflow;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * How top-level statements are partitioned into modules.
 *
 * <p>A block is never split across modules, and a statement containing a
 * RETURN always forms its own module, whatever the strategy.
 */
public enum ClusteringStrategy {
    /** Every top-level statement that performs a call becomes its own module. */
    IO_ISOLATION("io-isolation"),

    /** Every IF or FOR block becomes its own module; plain statements are grouped. */
    CONTROL_FLOW("control-flow"),

    /** Blocks first, then every remaining top-level call is isolated. */
    HYBRID("hybrid");

    private final String cliName;

    ClusteringStrategy(String cliName) {
        this.cliName = cliName;
    }

    public String getCliName() {
        return cliName;
    }

    /**
     * Resolves a strategy name. Accepts the enum name, the CLI name and the
     * camel-case form ({@code IoIsolation}), ignoring case.
     *
     * @param name strategy name
     * @return strategy, or empty when unknown
     */
    public static Optional<ClusteringStrategy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(strategy -> strategy.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst();
    }
}
