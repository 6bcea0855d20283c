package com.rigdef.parser;

import lombok.Getter;

/**
 * Closed table of keywords recognized at the start of a line.
 */
@Getter
public enum Keyword {

    // Global flags, no arguments
    DISABLEDEFAULTSOUNDS("disabledefaultsounds", Kind.GLOBAL_FLAG),
    ENABLE_ADVANCED_DEFORMATION("enable_advanced_deformation", Kind.GLOBAL_FLAG),
    FORWARDCOMMANDS("forwardcommands", Kind.GLOBAL_FLAG),
    HIDEINCHOOSER("hideInChooser", Kind.GLOBAL_FLAG),
    IMPORTCOMMANDS("importcommands", Kind.GLOBAL_FLAG),
    LOCKGROUP_DEFAULT_NOLOCK("lockgroup_default_nolock", Kind.GLOBAL_FLAG),
    RESCUER("rescuer", Kind.GLOBAL_FLAG),
    ROLLON("rollon", Kind.GLOBAL_FLAG),
    SLIDENODE_CONNECT_INSTANTLY("slidenode_connect_instantly", Kind.GLOBAL_FLAG),

    // Module switching
    SECTION("section", Kind.MODULE_SWITCH),
    END_SECTION("end_section", Kind.MODULE_SWITCH),

    // Block ends
    END("end", Kind.BLOCK_END),
    END_COMMENT("end_comment", Kind.BLOCK_END),
    END_DESCRIPTION("end_description", Kind.BLOCK_END),

    // Obsolete
    ENVMAP("envmap", Kind.IGNORED),
    HOOKGROUP("hookgroup", Kind.IGNORED),
    NODECOLLISION("nodecollision", Kind.IGNORED),
    RIGIDIFIERS("rigidifiers", Kind.IGNORED),
    SECTIONCONFIG("sectionconfig", Kind.IGNORED),
    SET_SHADOWS("set_shadows", Kind.IGNORED),
    SLOPEBRAKE("SlopeBrake", Kind.IGNORED),

    // Single-line directives
    ADD_ANIMATION("add_animation", Kind.DIRECTIVE),
    ANTILOCKBRAKES("AntiLockBrakes", Kind.DIRECTIVE),
    AUTHOR("author", Kind.DIRECTIVE),
    BACKMESH("backmesh", Kind.DIRECTIVE),
    CRUISECONTROL("cruisecontrol", Kind.DIRECTIVE),
    DETACHER_GROUP("detacher_group", Kind.DIRECTIVE),
    EXTCAMERA("extcamera", Kind.DIRECTIVE),
    FILEFORMATVERSION("fileformatversion", Kind.DIRECTIVE),
    FILEINFO("fileinfo", Kind.DIRECTIVE),
    FLEXBODY_CAMERA_MODE("flexbody_camera_mode", Kind.DIRECTIVE),
    FORSET("forset", Kind.DIRECTIVE),
    GUID("guid", Kind.DIRECTIVE),
    PROP_CAMERA_MODE("prop_camera_mode", Kind.DIRECTIVE),
    SET_BEAM_DEFAULTS("set_beam_defaults", Kind.DIRECTIVE),
    SET_BEAM_DEFAULTS_SCALE("set_beam_defaults_scale", Kind.DIRECTIVE),
    SET_COLLISION_RANGE("set_collision_range", Kind.DIRECTIVE),
    SET_DEFAULT_MINIMASS("set_default_minimass", Kind.DIRECTIVE),
    SET_INERTIA_DEFAULTS("set_inertia_defaults", Kind.DIRECTIVE),
    SET_MANAGEDMATERIALS_OPTIONS("set_managedmaterials_options", Kind.DIRECTIVE),
    SET_NODE_DEFAULTS("set_node_defaults", Kind.DIRECTIVE),
    SET_SKELETON_SETTINGS("set_skeleton_settings", Kind.DIRECTIVE),
    SPEEDLIMITER("speedlimiter", Kind.DIRECTIVE),
    SUBMESH("submesh", Kind.DIRECTIVE),
    SUBMESH_GROUNDMODEL("submesh_groundmodel", Kind.DIRECTIVE),
    TRACTIONCONTROL("TractionControl", Kind.DIRECTIVE),

    // Sections
    AIRBRAKES("airbrakes", Kind.SECTION),
    ANIMATORS("animators", Kind.SECTION),
    AXLES("axles", Kind.SECTION),
    BEAMS("beams", Kind.SECTION),
    BRAKES("brakes", Kind.SECTION),
    CAB("cab", Kind.SECTION),
    CAMERARAIL("camerarail", Kind.SECTION),
    CAMERAS("cameras", Kind.SECTION),
    CINECAM("cinecam", Kind.SECTION),
    COLLISIONBOXES("collisionboxes", Kind.SECTION),
    COMMANDS("commands", Kind.SECTION),
    COMMANDS2("commands2", Kind.SECTION),
    COMMENT("comment", Kind.SECTION),
    CONTACTERS("contacters", Kind.SECTION),
    DESCRIPTION("description", Kind.SECTION),
    ENGINE("engine", Kind.SECTION),
    ENGOPTION("engoption", Kind.SECTION),
    ENGTURBO("engturbo", Kind.SECTION),
    EXHAUSTS("exhausts", Kind.SECTION),
    FIXES("fixes", Kind.SECTION),
    FLARES("flares", Kind.SECTION),
    FLARES2("flares2", Kind.SECTION),
    FLEXBODIES("flexbodies", Kind.SECTION),
    FLEXBODYWHEELS("flexbodywheels", Kind.SECTION),
    FUSEDRAG("fusedrag", Kind.SECTION),
    GLOBALS("globals", Kind.SECTION),
    GUISETTINGS("guisettings", Kind.SECTION),
    HELP("help", Kind.SECTION),
    HOOKS("hooks", Kind.SECTION),
    HYDROS("hydros", Kind.SECTION),
    INTERAXLES("interaxles", Kind.SECTION),
    LOCKGROUPS("lockgroups", Kind.SECTION),
    MANAGEDMATERIALS("managedmaterials", Kind.SECTION),
    MATERIALFLAREBINDINGS("materialflarebindings", Kind.SECTION),
    MESHWHEELS("meshwheels", Kind.SECTION),
    MESHWHEELS2("meshwheels2", Kind.SECTION),
    MINIMASS("minimass", Kind.SECTION),
    NODES("nodes", Kind.SECTION),
    NODES2("nodes2", Kind.SECTION),
    PARTICLES("particles", Kind.SECTION),
    PISTONPROPS("pistonprops", Kind.SECTION),
    PROPS("props", Kind.SECTION),
    RAILGROUPS("railgroups", Kind.SECTION),
    ROPABLES("ropables", Kind.SECTION),
    ROPES("ropes", Kind.SECTION),
    ROTATORS("rotators", Kind.SECTION),
    ROTATORS2("rotators2", Kind.SECTION),
    SCREWPROPS("screwprops", Kind.SECTION),
    SHOCKS("shocks", Kind.SECTION),
    SHOCKS2("shocks2", Kind.SECTION),
    SHOCKS3("shocks3", Kind.SECTION),
    SLIDENODES("slidenodes", Kind.SECTION),
    SOUNDSOURCES("soundsources", Kind.SECTION),
    SOUNDSOURCES2("soundsources2", Kind.SECTION),
    TEXCOORDS("texcoords", Kind.SECTION),
    TIES("ties", Kind.SECTION),
    TORQUECURVE("torquecurve", Kind.SECTION),
    TRANSFERCASE("transfercase", Kind.SECTION),
    TRIGGERS("triggers", Kind.SECTION),
    TURBOJETS("turbojets", Kind.SECTION),
    TURBOPROPS("turboprops", Kind.SECTION),
    TURBOPROPS2("turboprops2", Kind.SECTION),
    VIDEOCAMERA("videocamera", Kind.SECTION),
    WHEELDETACHERS("wheeldetachers", Kind.SECTION),
    WHEELS("wheels", Kind.SECTION),
    WHEELS2("wheels2", Kind.SECTION),
    WINGS("wings", Kind.SECTION);

    public enum Kind {
        /** Sets a document-wide flag. */
        GLOBAL_FLAG,
        /** Processed immediately, leaves the open block alone. */
        DIRECTIVE,
        /** Opens a block; following data lines use its grammar. */
        SECTION,
        BLOCK_END,
        MODULE_SWITCH,
        IGNORED
    }

    private final String text;
    private final Kind kind;

    Keyword(String text, Kind kind) {
        this.text = text;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return text;
    }
}
