package com.dslforge.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared type of a DSL variable.
 *
 * <p>Type names are matched case-insensitively ({@code Integer}, {@code integer}
 * and {@code INTEGER} are the same type).
 */
public enum VarType {
    INTEGER("Integer"),
    FLOAT("Float"),
    STRING("String"),
    BOOLEAN("Boolean"),
    LIST("List"),
    DICT("Dict"),
    /** No declared constraint. */
    ANY("Any");

    private final String displayName;

    VarType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used in DSL source.
     *
     * @return display name, e.g. {@code Integer}
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a DSL type name.
     *
     * @param name type name as written in source
     * @return the type, or empty if the name is unknown
     */
    public static Optional<VarType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.displayName.toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst();
    }

    /**
     * Whether values of this type may appear in an ordering comparison.
     *
     * @return true for numeric types and {@link #ANY}
     */
    public boolean isNumericCompatible() {
        return this == INTEGER || this == FLOAT || this == ANY;
    }

    /**
     * Whether values of this type may appear on the right of {@code IN}.
     *
     * @return true for collections, strings and {@link #ANY}
     */
    public boolean isContainerCompatible() {
        return this == LIST || this == DICT || this == STRING || this == ANY;
    }
}
