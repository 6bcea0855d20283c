package com.rigdef.model.defaults;

import lombok.Value;

/**
 * Options set by "set_managedmaterials_options".
 */
@Value
public class ManagedMaterialOptions {

    public static final ManagedMaterialOptions BUILTIN = new ManagedMaterialOptions(false);

    boolean doubleSided;
}
