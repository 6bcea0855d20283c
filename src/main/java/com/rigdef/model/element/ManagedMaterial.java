package com.rigdef.model.element;

import com.rigdef.model.defaults.ManagedMaterialOptions;

import lombok.Data;

@Data
public class ManagedMaterial {
    private String name;
    private ManagedMaterialType type;
    private ManagedMaterialOptions options;
    private String diffuseMap;
    private String damagedDiffuseMap = "";
    private String specularMap = "";

    public boolean hasDamagedDiffuseMap() {
        return isTextureSet(damagedDiffuseMap);
    }

    public boolean hasSpecularMap() {
        return isTextureSet(specularMap);
    }

    private static boolean isTextureSet(String texture) {
        return texture != null && !texture.isEmpty() && texture.charAt(0) != '-';
    }
}
