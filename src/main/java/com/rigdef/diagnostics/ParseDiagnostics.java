package com.rigdef.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) collected while parsing one file.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics implements DiagnosticsSink {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    @Override
    public void report(Severity severity, String text) {
        switch (severity) {
            case ERROR -> errors.add(text);
            case WARNING -> warnings.add(text);
            default -> infos.add(text);
        }
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int size() {
        return errors.size() + warnings.size() + infos.size();
    }
}
