package com.rigdef.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.rigdef.cli.exception.OptionsValidationException;
import com.rigdef.cli.model.InspectOptions;
import com.rigdef.cli.model.ValidatedInspectOptions;

public class InspectOptionsValidator {

    public ValidatedInspectOptions validate(InspectOptions o) {
        List<String> errors = new ArrayList<>();

        Path file = null;
        if (o.getFile() == null) {
            errors.add("A rig definition file is required.");
        } else {
            file = o.getFile().toAbsolutePath().normalize();
            if (!Files.isRegularFile(file)) {
                errors.add("Rig definition file does not exist or is not a file: " + o.getFile());
            }
        }

        List<Path> resourceDirs = new ArrayList<>();
        if (o.getResourceDirs() != null) {
            for (Path dir : o.getResourceDirs()) {
                if (!existsDirectory(dir)) {
                    errors.add("Resource directory does not exist or is not a directory: " + dir);
                } else {
                    resourceDirs.add(dir.toAbsolutePath().normalize());
                }
            }
        }

        if (isBlank(o.getResourceGroup())) {
            errors.add("Resource group must not be blank (--resource-group).");
        }

        Path reportFile = null;
        if (o.getReportFile() != null) {
            reportFile = o.getReportFile().toAbsolutePath().normalize();
            Path parent = reportFile.getParent();
            if (parent != null && !existsDirectory(parent)) {
                errors.add("Report directory does not exist: " + parent);
            } else if (Files.isDirectory(reportFile)) {
                errors.add("Report path is a directory: " + o.getReportFile());
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedInspectOptions(file, List.copyOf(resourceDirs), reportFile);
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
