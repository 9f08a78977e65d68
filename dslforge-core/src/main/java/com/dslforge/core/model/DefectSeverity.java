package com.dslforge.core.model;

/**
 * Severity level for defects found while parsing, analyzing or validating DSL.
 */
public enum DefectSeverity {
    /**
     * Warning - reported to the caller but never blocks code generation.
     */
    WARNING,

    /**
     * Error - the program must not be synthesized while this defect remains.
     */
    ERROR
}
