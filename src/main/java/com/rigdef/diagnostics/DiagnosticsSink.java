package com.rigdef.diagnostics;

/**
 * Receives formatted diagnostic messages from the parser.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    void report(Severity severity, String text);
}
