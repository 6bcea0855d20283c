package com.rigdef;

import com.rigdef.cli.InspectCommand;

import picocli.CommandLine;

/**
 * Main entry point for the rig definition inspector.
 * Parses a truck file and reports its contents and any problems found in it.
 */
public class RigDefApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new InspectCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
