package com.rigdef.cli.exception;

import java.util.List;

/**
 * Thrown when the "inspect" options are inconsistent. Carries every problem found, not just the first.
 */
public class OptionsValidationException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
