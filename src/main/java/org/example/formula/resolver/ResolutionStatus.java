package org.example.formula.resolver;

/**
 * Terminal states of a resolution run.
 */
public enum ResolutionStatus {

    /** A consistent selection was found. */
    SOLVED,

    /** Every choice was tried without success. */
    EXHAUSTED,

    /** The caller cancelled the run or the step budget ran out. */
    CANCELLED
}
