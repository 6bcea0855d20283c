package com.rigdef.cli.report;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.Module;

import lombok.Value;

/**
 * Element counts of one module. Only non-empty collections are listed, in declaration order of
 * the module's fields.
 */
@Value
public class ModuleSummary {
    String name;
    List<ElementCount> counts;

    public int getTotal() {
        return counts.stream().mapToInt(ElementCount::getCount).sum();
    }

    public static ModuleSummary of(Module m) {
        List<ElementCount> counts = new ArrayList<>();
        add(counts, "nodes", m.getNodes());
        add(counts, "beams", m.getBeams());
        add(counts, "shocks", m.getShocks());
        add(counts, "shocks2", m.getShocks2());
        add(counts, "shocks3", m.getShocks3());
        add(counts, "hydros", m.getHydros());
        add(counts, "commands", m.getCommands());
        add(counts, "rotators", m.getRotators());
        add(counts, "animators", m.getAnimators());
        add(counts, "triggers", m.getTriggers());
        add(counts, "ties", m.getTies());
        add(counts, "ropes", m.getRopes());
        add(counts, "ropables", m.getRopables());
        add(counts, "fixes", m.getFixes());
        add(counts, "contacters", m.getContacters());
        add(counts, "slidenodes", m.getSlideNodes());
        add(counts, "railgroups", m.getRailGroups());
        add(counts, "lockgroups", m.getLockgroups());
        add(counts, "hooks", m.getHooks());
        add(counts, "collisionboxes", m.getCollisionBoxes());
        add(counts, "minimass", m.getMinimass());
        add(counts, "cinecam", m.getCinecams());
        add(counts, "cameras", m.getCameras());
        add(counts, "camerarail", m.getCameraRails());
        add(counts, "wheels", m.getWheels());
        add(counts, "wheels2", m.getWheels2());
        add(counts, "meshwheels", m.getMeshWheels());
        add(counts, "flexbodywheels", m.getFlexBodyWheels());
        add(counts, "wheeldetachers", m.getWheelDetachers());
        add(counts, "wings", m.getWings());
        add(counts, "airbrakes", m.getAirbrakes());
        add(counts, "fusedrag", m.getFusedrag());
        add(counts, "turbojets", m.getTurbojets());
        add(counts, "turboprops", m.getTurboprops());
        add(counts, "pistonprops", m.getPistonprops());
        add(counts, "screwprops", m.getScrewprops());
        add(counts, "engine", m.getEngines());
        add(counts, "engoption", m.getEngoptions());
        add(counts, "engturbo", m.getEngturbos());
        add(counts, "torquecurve", m.getTorqueCurves());
        add(counts, "brakes", m.getBrakes());
        add(counts, "axles", m.getAxles());
        add(counts, "interaxles", m.getInterAxles());
        add(counts, "transfercase", m.getTransferCases());
        add(counts, "tractioncontrol", m.getTractionControls());
        add(counts, "antilockbrakes", m.getAntiLockBrakes());
        add(counts, "cruisecontrol", m.getCruiseControls());
        add(counts, "speedlimiter", m.getSpeedLimiters());
        add(counts, "props", m.getProps());
        add(counts, "flexbodies", m.getFlexbodies());
        add(counts, "flares", m.getFlares());
        add(counts, "materialflarebindings", m.getMaterialFlareBindings());
        add(counts, "managedmaterials", m.getManagedMaterials());
        add(counts, "submesh", m.getSubmeshes());
        add(counts, "exhausts", m.getExhausts());
        add(counts, "particles", m.getParticles());
        add(counts, "videocamera", m.getVideoCameras());
        add(counts, "soundsources", m.getSoundSources());
        add(counts, "soundsources2", m.getSoundSources2());
        add(counts, "extcamera", m.getExtCameras());
        add(counts, "globals", m.getGlobals());
        add(counts, "guisettings", m.getGuiSettings());
        add(counts, "help", m.getHelp());
        add(counts, "description", m.getDescription());
        add(counts, "author", m.getAuthors());
        add(counts, "fileinfo", m.getFileinfo());
        add(counts, "guid", m.getGuid());
        return new ModuleSummary(m.getName(), List.copyOf(counts));
    }

    private static void add(List<ElementCount> counts, String label, List<?> elements) {
        if (!elements.isEmpty()) {
            counts.add(new ElementCount(label, elements.size()));
        }
    }
}
