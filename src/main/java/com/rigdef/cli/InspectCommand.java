package com.rigdef.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.cli.exception.OptionsValidationException;
import com.rigdef.cli.model.InspectOptions;
import com.rigdef.cli.model.ValidatedInspectOptions;
import com.rigdef.cli.output.InspectResultsPrinter;
import com.rigdef.cli.report.RigSummary;
import com.rigdef.cli.report.SummaryReportWriter;
import com.rigdef.cli.validation.InspectOptionsValidator;
import com.rigdef.diagnostics.DiagnosticsSink;
import com.rigdef.diagnostics.LoggingDiagnosticsSink;
import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.RigDocument;
import com.rigdef.parser.ParserConfig;
import com.rigdef.parser.RigDefParseException;
import com.rigdef.parser.RigDefParser;
import com.rigdef.resource.DirectoryResourceLocator;
import com.rigdef.resource.ResourceLocator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that parses one rig definition file and reports what it contains.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        version = "rigdef-parser 1.0.0",
        description = "Parses a rig definition (truck) file and prints its modules, element counts and diagnostics."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_PARSE_ERRORS = 2;

    @Mixin
    private InspectOptions options = new InspectOptions();

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final InspectResultsPrinter printer = new InspectResultsPrinter();
    private final SummaryReportWriter reportWriter = new SummaryReportWriter();

    @Override
    public Integer call() {
        try {
            ValidatedInspectOptions validated;
            try {
                validated = validator.validate(options);
            } catch (OptionsValidationException e) {
                printer.printValidationErrors(e.getErrors());
                return EXIT_FAILURE;
            }

            printer.printBanner(options, validated);

            ParseDiagnostics diagnostics = new ParseDiagnostics();
            DiagnosticsSink sink = options.isVerbose() ? new LoggingDiagnosticsSink(diagnostics) : diagnostics;
            RigDefParser parser = new RigDefParser(buildConfig(validated), sink);

            Path file = validated.getFile();
            RigDocument document;
            try {
                document = parser.parse(file);
            } catch (RigDefParseException e) {
                log.error("Inspection failed: {}", e.getMessage());
                return EXIT_FAILURE;
            }

            RigSummary summary = RigSummary.of(file.getFileName().toString(), document, diagnostics);
            printer.printResults(summary);

            if (validated.getReportFile() != null) {
                reportWriter.write(summary, validated.getReportFile());
                log.info("Report written to {}", validated.getReportFile());
            }

            if (options.isStrict() && diagnostics.hasErrors()) {
                log.error("{} error(s) reported in strict mode", diagnostics.getErrors().size());
                return EXIT_PARSE_ERRORS;
            }
            return EXIT_OK;

        } catch (Exception e) {
            log.error("Inspection failed with exception", e);
            return EXIT_FAILURE;
        }
    }

    private ParserConfig buildConfig(ValidatedInspectOptions validated) {
        ResourceLocator locator = validated.getResourceDirs().isEmpty()
                ? ResourceLocator.ANY
                : new DirectoryResourceLocator(validated.getResourceDirs());
        return ParserConfig.builder()
                .resourceGroup(options.getResourceGroup())
                .resourceLocator(locator)
                .sequentialImport(!options.isNoSequentialImport())
                .build();
    }
}
