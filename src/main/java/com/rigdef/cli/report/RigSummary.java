package com.rigdef.cli.report;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.Module;
import com.rigdef.model.RigDocument;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of a parse result, shared by the console printer and the report template.
 */
@Value
@Builder
public class RigSummary {
    String fileName;
    String title;
    List<String> globalFlags;
    List<ModuleSummary> modules;
    List<String> errors;
    List<String> warnings;
    List<String> infos;

    public static RigSummary of(String fileName, RigDocument doc, ParseDiagnostics diagnostics) {
        List<ModuleSummary> modules = new ArrayList<>();
        modules.add(ModuleSummary.of(doc.getRootModule()));
        for (Module m : doc.getUserModules().values()) {
            modules.add(ModuleSummary.of(m));
        }
        return RigSummary.builder()
                .fileName(fileName)
                .title(doc.getTitle())
                .globalFlags(globalFlags(doc))
                .modules(List.copyOf(modules))
                .errors(List.copyOf(diagnostics.getErrors()))
                .warnings(List.copyOf(diagnostics.getWarnings()))
                .infos(List.copyOf(diagnostics.getInfos()))
                .build();
    }

    private static List<String> globalFlags(RigDocument doc) {
        List<String> flags = new ArrayList<>();
        if (doc.isDisableDefaultSounds()) {
            flags.add("disabledefaultsounds");
        }
        if (doc.isEnableAdvancedDeformation()) {
            flags.add("enable_advanced_deformation");
        }
        if (doc.isForwardCommands()) {
            flags.add("forwardcommands");
        }
        if (doc.isHideInChooser()) {
            flags.add("hideInChooser");
        }
        if (doc.isImportCommands()) {
            flags.add("importcommands");
        }
        if (doc.isLockgroupDefaultNolock()) {
            flags.add("lockgroup_default_nolock");
        }
        if (doc.isRescuer()) {
            flags.add("rescuer");
        }
        if (doc.isRollon()) {
            flags.add("rollon");
        }
        if (doc.isSlidenodeConnectInstantly()) {
            flags.add("slidenode_connect_instantly");
        }
        return List.copyOf(flags);
    }
}
