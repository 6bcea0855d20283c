package com.rigdef.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.Setter;

/**
 * Formats parser messages with their location and forwards them to a {@link DiagnosticsSink}.
 *
 * Format: {@code <file>:<line> (<keyword>): <message>}. The keyword part is omitted when no
 * keyword is active. Reporting never throws; a failing sink is logged and otherwise ignored.
 */
public class DiagnosticsReporter {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsReporter.class);

    private final DiagnosticsSink sink;

    @Getter
    private final String fileName;

    @Getter
    @Setter
    private int lineNumber;

    @Getter
    @Setter
    private String keyword;

    @Getter
    private int errorCount;

    @Getter
    private int warningCount;

    public DiagnosticsReporter(DiagnosticsSink sink, String fileName) {
        this.sink = sink;
        this.fileName = fileName == null ? "" : fileName;
    }

    public void info(String message) {
        report(Severity.INFO, message);
    }

    public void warning(String message) {
        report(Severity.WARNING, message);
    }

    public void error(String message) {
        report(Severity.ERROR, message);
    }

    public void report(Severity severity, String message) {
        reportAt(severity, lineNumber, keyword, message);
    }

    /**
     * Reports a message attributed to an explicit line, used for problems discovered after the
     * offending line was processed.
     */
    public void reportAt(Severity severity, int line, String atKeyword, String message) {
        if (severity == Severity.ERROR) {
            errorCount++;
        } else if (severity == Severity.WARNING) {
            warningCount++;
        }
        String text = format(line, atKeyword, message);
        if (sink == null) {
            return;
        }
        try {
            sink.report(severity, text);
        } catch (RuntimeException e) {
            log.warn("Diagnostics sink failed for message '{}': {}", text, e.getMessage());
        }
    }

    String format(int line, String atKeyword, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(fileName).append(':').append(line);
        if (atKeyword != null && !atKeyword.isEmpty()) {
            sb.append(" (").append(atKeyword).append(')');
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
