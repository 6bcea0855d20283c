package com.rigdef.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "inspect" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class InspectOptions {

    @Parameters(index = "0", paramLabel = "<file>", description = "Rig definition file to parse (.truck, .car, .load, ...)")
    private Path file;

    @Option(names = { "--resource-dir",
            "-r" }, description = "Directory searched for textures referenced by managed materials (repeatable)")
    private List<Path> resourceDirs = new ArrayList<>();

    @Option(names = {
            "--resource-group" }, defaultValue = "General", description = "Resource group used for texture lookups (default: General)")
    private String resourceGroup;

    @Option(names = {
            "--no-sequential-import" }, description = "Resolve node references immediately instead of at the end of the file")
    private boolean noSequentialImport;

    @Option(names = { "--strict" }, description = "Exit with code 2 when the parser reported errors")
    private boolean strict;

    @Option(names = { "--report", "-o" }, description = "Write a text summary of the parsed rig to this file")
    private Path reportFile;

    @Option(names = { "--verbose", "-v" }, description = "Log every diagnostic as it is reported")
    private boolean verbose;
}
