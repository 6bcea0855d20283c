package com.rigdef.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink that writes every diagnostic to the application log and passes it on to an optional delegate.
 */
public class LoggingDiagnosticsSink implements DiagnosticsSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticsSink.class);

    private final DiagnosticsSink delegate;

    public LoggingDiagnosticsSink(DiagnosticsSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void report(Severity severity, String text) {
        switch (severity) {
            case ERROR -> log.error(text);
            case WARNING -> log.warn(text);
            default -> log.info(text);
        }
        if (delegate != null) {
            delegate.report(severity, text);
        }
    }
}
