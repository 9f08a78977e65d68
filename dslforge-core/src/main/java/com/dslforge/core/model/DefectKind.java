package com.dslforge.core.model;

/**
 * Closed set of defect kinds.
 *
 * <p>Every consumer switches over this enum exhaustively. Adding a kind means
 * deciding, in each of those places, whether it is repairable and how it is
 * reported.
 */
public enum DefectKind {
    DUPLICATE_DEFINITION("DuplicateDefinition", DefectSeverity.ERROR),
    UNDEFINED_VARIABLE("UndefinedVariable", DefectSeverity.ERROR),
    UNCLOSED_BLOCK("UnclosedBlock", DefectSeverity.ERROR),
    UNEXPECTED_CLOSE("UnexpectedClose", DefectSeverity.ERROR),
    INVALID_IDENTIFIER("InvalidIdentifier", DefectSeverity.ERROR),
    TYPE_MISMATCH("TypeMismatch", DefectSeverity.ERROR),
    CYCLIC_DEPENDENCY("CyclicDependency", DefectSeverity.ERROR),
    UNPARSABLE_CALL_EXPRESSION("UnparsableCallExpression", DefectSeverity.ERROR),
    /** A keyword line that does not have the shape of its statement. */
    MALFORMED_STATEMENT("MalformedStatement", DefectSeverity.ERROR),
    /** A branch that can never run because its condition is constant. */
    DEAD_BRANCH("DeadBranch", DefectSeverity.WARNING);

    private final String displayName;
    private final DefectSeverity severity;

    DefectKind(String displayName, DefectSeverity severity) {
        this.displayName = displayName;
        this.severity = severity;
    }

    /**
     * Returns the name shown in reports and regeneration prompts.
     *
     * @return display name, e.g. {@code UnclosedBlock}
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the severity every defect of this kind carries.
     *
     * @return severity
     */
    public DefectSeverity getSeverity() {
        return severity;
    }
}
