package com.rigdef.resource;

/**
 * Answers whether a named resource (texture, mesh) exists in a resource group.
 */
@FunctionalInterface
public interface ResourceLocator {

    /** Locator that reports every resource as present. */
    ResourceLocator ANY = (group, name) -> true;

    boolean exists(String group, String name);
}
