package com.rigdef.model.element;

import lombok.Data;

@Data
public class Fileinfo {
    private String uniqueId;
    private int categoryId = -1;
    private int fileVersion;
}
