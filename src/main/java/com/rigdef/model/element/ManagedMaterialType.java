package com.rigdef.model.element;

/**
 * Effect types of the "managedmaterials" section.
 */
public enum ManagedMaterialType {
    MESH_STANDARD("mesh_standard"),
    MESH_TRANSPARENT("mesh_transparent"),
    FLEXMESH_STANDARD("flexmesh_standard"),
    FLEXMESH_TRANSPARENT("flexmesh_transparent");

    private final String token;

    ManagedMaterialType(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static ManagedMaterialType fromToken(String token) {
        for (ManagedMaterialType value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        return null;
    }
}
