package com.rigdef.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized values needed by the executor. Keeps InspectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedInspectOptions {
    Path file;
    List<Path> resourceDirs;
    Path reportFile;
}
