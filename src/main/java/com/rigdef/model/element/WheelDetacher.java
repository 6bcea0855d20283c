package com.rigdef.model.element;

import lombok.Data;

@Data
public class WheelDetacher {
    private int wheelId;
    private int detacherGroup;
}
