package com.rigdef.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.cli.model.InspectOptions;
import com.rigdef.cli.model.ValidatedInspectOptions;
import com.rigdef.cli.report.ElementCount;
import com.rigdef.cli.report.ModuleSummary;
import com.rigdef.cli.report.RigSummary;

/**
 * Responsible only for printing CLI output for the "inspect" command.
 * No validation, no parsing.
 */
public class InspectResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(InspectResultsPrinter.class);

    private static final int MAX_LISTED_DIAGNOSTICS = 20;

    public void printBanner(InspectOptions o, ValidatedInspectOptions v) {
        log.info("=================================================");
        log.info("Rig Definition Inspector");
        log.info("=================================================");
        log.info("File: {}", v.getFile());
        log.info("Resource Group: {}", o.getResourceGroup());
        if (v.getResourceDirs().isEmpty()) {
            log.info("Resource Directories: {}", "None (texture checks disabled)");
        } else {
            log.info("Resource Directories: {}", v.getResourceDirs());
        }
        log.info("Sequential Import: {}", !o.isNoSequentialImport());
        log.info("Strict Mode: {}", o.isStrict());
        log.info("Report File: {}", v.getReportFile() != null ? v.getReportFile() : "None");
        log.info("=================================================");
    }

    public void printResults(RigSummary summary) {
        log.info("");
        log.info("=================================================");
        log.info("PARSING FINISHED");
        log.info("=================================================");
        log.info("Title: {}", summary.getTitle() != null ? summary.getTitle() : "(none)");
        if (!summary.getGlobalFlags().isEmpty()) {
            log.info("Flags: {}", String.join(", ", summary.getGlobalFlags()));
        }

        for (ModuleSummary module : summary.getModules()) {
            log.info("");
            log.info("Module '{}': {} elements", module.getName(), module.getTotal());
            for (ElementCount count : module.getCounts()) {
                log.info("  {}: {}", count.getLabel(), count.getCount());
            }
        }

        log.info("");
        log.info("Diagnostics Summary:");
        log.info("  Errors: {}", summary.getErrors().size());
        log.info("  Warnings: {}", summary.getWarnings().size());
        log.info("  Notes: {}", summary.getInfos().size());
        summary.getErrors().stream().limit(MAX_LISTED_DIAGNOSTICS).forEach(e -> log.error("  {}", e));
        summary.getWarnings().stream().limit(MAX_LISTED_DIAGNOSTICS).forEach(w -> log.warn("  {}", w));
        int hidden = Math.max(0, summary.getErrors().size() - MAX_LISTED_DIAGNOSTICS)
                + Math.max(0, summary.getWarnings().size() - MAX_LISTED_DIAGNOSTICS);
        if (hidden > 0) {
            log.info("  ... {} more (use --report for the full list)", hidden);
        }
        log.info("=================================================");
    }

    public void printValidationErrors(Iterable<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  {}", error);
        }
    }
}
