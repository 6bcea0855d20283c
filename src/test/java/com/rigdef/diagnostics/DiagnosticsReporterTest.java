package com.rigdef.diagnostics;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DiagnosticsReporter.
 */
class DiagnosticsReporterTest {

    @Test
    void testMessageCarriesFileLineAndKeyword() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        DiagnosticsReporter reporter = new DiagnosticsReporter(diagnostics, "truck.truck");
        reporter.setLineNumber(42);
        reporter.setKeyword("beams");

        reporter.error("broken");
        reporter.setKeyword(null);
        reporter.warning("odd");
        reporter.info("note");

        assertThat(diagnostics.getErrors()).containsExactly("truck.truck:42 (beams): broken");
        assertThat(diagnostics.getWarnings()).containsExactly("truck.truck:42: odd");
        assertThat(diagnostics.getInfos()).containsExactly("truck.truck:42: note");
        assertThat(reporter.getErrorCount()).isEqualTo(1);
        assertThat(reporter.getWarningCount()).isEqualTo(1);
    }

    @Test
    void testReportAtUsesExplicitLocation() {
        List<String> received = new ArrayList<>();
        DiagnosticsReporter reporter = new DiagnosticsReporter((severity, text) -> received.add(severity + " " + text),
                "a.load");
        reporter.setLineNumber(99);

        reporter.reportAt(Severity.WARNING, 7, "nodes", "late");

        assertThat(received).containsExactly("WARNING a.load:7 (nodes): late");
    }

    @Test
    void testFailingSinkDoesNotPropagate() {
        DiagnosticsReporter reporter = new DiagnosticsReporter((severity, text) -> {
            throw new IllegalStateException("sink down");
        }, "x.truck");

        assertThatCode(() -> reporter.error("boom")).doesNotThrowAnyException();
        assertThat(reporter.getErrorCount()).isEqualTo(1);
    }

    @Test
    void testNullSinkStillCounts() {
        DiagnosticsReporter reporter = new DiagnosticsReporter(null, null);

        reporter.warning("w");

        assertThat(reporter.getWarningCount()).isEqualTo(1);
        assertThat(reporter.getFileName()).isEmpty();
    }

    @Test
    void testLoggingSinkForwardsToDelegate() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        LoggingDiagnosticsSink sink = new LoggingDiagnosticsSink(diagnostics);

        sink.report(Severity.ERROR, "e");
        sink.report(Severity.INFO, "i");

        assertThat(diagnostics.getErrors()).containsExactly("e");
        assertThat(diagnostics.getInfos()).containsExactly("i");
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.hasWarnings()).isFalse();
        assertThat(diagnostics.size()).isEqualTo(2);
    }
}
