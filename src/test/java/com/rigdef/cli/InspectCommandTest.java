package com.rigdef.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InspectCommand.
 */
class InspectCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testInspectValidFile() throws IOException {
        Path truck = writeTruck("""
                My Truck
                nodes
                1, 0, 0, 0
                2, 1, 0, 0
                beams
                1, 2
                end
                """);

        int exitCode = execute(truck.toString());

        assertThat(exitCode).isEqualTo(InspectCommand.EXIT_OK);
    }

    @Test
    void testMissingFileFailsValidation() {
        int exitCode = execute(tempDir.resolve("nope.truck").toString());

        assertThat(exitCode).isEqualTo(InspectCommand.EXIT_FAILURE);
    }

    @Test
    void testStrictModeFailsOnParseErrors() throws IOException {
        Path truck = writeTruck("""
                My Truck
                end_section
                """);

        assertThat(execute(truck.toString())).isEqualTo(InspectCommand.EXIT_OK);
        assertThat(execute("--strict", truck.toString())).isEqualTo(InspectCommand.EXIT_PARSE_ERRORS);
    }

    @Test
    void testReportIsWritten() throws IOException {
        Path truck = writeTruck("""
                My Truck
                rescuer
                nodes
                1, 0, 0, 0
                2, 1, 0, 0
                beams
                1, 2
                section 1 extras
                beams
                1, 2
                end_section
                """);
        Path report = tempDir.resolve("summary.txt");

        int exitCode = execute("--report", report.toString(), truck.toString());

        assertThat(exitCode).isEqualTo(InspectCommand.EXIT_OK);
        assertThat(report).exists();
        String text = Files.readString(report);
        assertThat(text).contains("File:  rig.truck");
        assertThat(text).contains("Title: My Truck");
        assertThat(text).contains("Flags: rescuer");
        assertThat(text).contains("Module _Root_ (3 elements)");
        assertThat(text).contains("  nodes: 2");
        assertThat(text).contains("Module extras (1 elements)");
        assertThat(text).contains("Diagnostics: 0 errors, 0 warnings, 0 notes");
    }

    @Test
    void testMissingResourceDirFailsValidation() throws IOException {
        Path truck = writeTruck("""
                My Truck
                """);

        int exitCode = execute("-r", tempDir.resolve("textures").toString(), truck.toString());

        assertThat(exitCode).isEqualTo(InspectCommand.EXIT_FAILURE);
    }

    private Path writeTruck(String content) throws IOException {
        Path file = tempDir.resolve("rig.truck");
        Files.writeString(file, content);
        return file;
    }

    private static int execute(String... args) {
        return new CommandLine(new InspectCommand()).execute(args);
    }
}
