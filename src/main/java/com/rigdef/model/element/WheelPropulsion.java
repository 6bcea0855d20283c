package com.rigdef.model.element;

/**
 * Propulsion of a wheel, written as a number 0-2.
 */
public enum WheelPropulsion {
    NONE,
    FORWARD,
    BACKWARD;

    public static WheelPropulsion fromNumber(int number) {
        WheelPropulsion[] values = values();
        return (number >= 0 && number < values.length) ? values[number] : null;
    }
}
