package com.rigdef.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/**
 * Parsed rig definition: title, global flags, the root module and any user modules.
 */
@Getter
@Setter
public class RigDocument {

    /** First meaningful line of the file; set once. */
    private String title;

    private boolean disableDefaultSounds;
    private boolean enableAdvancedDeformation;
    private boolean forwardCommands;
    private boolean importCommands;
    private boolean hideInChooser;
    private boolean lockgroupDefaultNolock;
    private boolean rescuer;
    private boolean rollon;
    private boolean slidenodeConnectInstantly;

    private final Module rootModule = new Module(Module.ROOT_MODULE_NAME);

    private final Map<String, Module> userModules = new LinkedHashMap<>();

    /**
     * @return user modules by name, in order of first appearance
     */
    public Map<String, Module> getUserModules() {
        return Collections.unmodifiableMap(userModules);
    }

    /**
     * Returns the user module with the given name, creating it on first use.
     */
    public Module getOrCreateModule(String name) {
        return userModules.computeIfAbsent(name, Module::new);
    }

    /**
     * @return the root module for {@value Module#ROOT_MODULE_NAME}, the user module otherwise, or
     *         {@code null} when no such module exists
     */
    public Module getModule(String name) {
        if (Module.ROOT_MODULE_NAME.equals(name)) {
            return rootModule;
        }
        return userModules.get(name);
    }
}
