package com.dslforge.core.model;

/**
 * Terminal status of a transpile session.
 */
public enum TranspileStatus {
    SUCCESS,
    FAILURE
}
