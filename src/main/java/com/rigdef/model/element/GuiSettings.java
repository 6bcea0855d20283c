package com.rigdef.model.element;

import lombok.Data;

@Data
public class GuiSettings {
    private String key;
    private String value;
}
