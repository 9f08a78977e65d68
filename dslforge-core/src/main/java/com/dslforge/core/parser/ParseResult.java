package com.dslforge.core.parser;

import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one DSL draft.
 *
 * @param statements top-level statements in source order
 * @param defects every structural defect found, sorted by position
 */
public record ParseResult(
    List<Statement> statements,
    List<Defect> defects
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(statements, "statements must not be null");
        Objects.requireNonNull(defects, "defects must not be null");
        statements = List.copyOf(statements);
        defects = List.copyOf(defects);
    }

    /**
     * Creates a result with no statements and no defects.
     *
     * @return empty result
     */
    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of());
    }

    /**
     * Defects that exist only in the source text and cannot be seen again by
     * re-validating the statement tree, such as a stray {@code ENDIF} or a
     * dropped malformed line. They have to travel with the tree across repair
     * rounds. Unclosed blocks are not among them: the tree keeps an open
     * flag the validator re-checks.
     *
     * @return defects to carry alongside the statements
     */
    public List<Defect> carriedDefects() {
        return defects.stream()
            .filter(defect -> defect.kind() != DefectKind.UNCLOSED_BLOCK)
            .toList();
    }

    /**
     * Whether parsing found any defect.
     *
     * @return true if defects exist
     */
    public boolean hasDefects() {
        return !defects.isEmpty();
    }
}
