package com.rigdef.diagnostics;

/**
 * Severity of a parser diagnostic.
 */
public enum Severity {
    /** Informational note, nothing was lost. */
    INFO,
    /** Input was malformed but a usable value was substituted or the line was skipped. */
    WARNING,
    /** Input could not be interpreted; data was dropped. */
    ERROR
}
