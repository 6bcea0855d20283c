package com.rigdef.parser;

/**
 * Raised when a rig definition cannot be opened at all. Problems inside the file are reported
 * as diagnostics instead.
 */
public class RigDefParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RigDefParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
