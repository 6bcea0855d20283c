package com.rigdef.model.element;

import lombok.Data;

@Data
public class MaterialFlareBinding {
    private int flareNumber;
    private String materialName;
}
