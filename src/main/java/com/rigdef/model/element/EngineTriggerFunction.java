package com.rigdef.model.element;

/**
 * Engine input driven by a trigger with option 'E'.
 */
public enum EngineTriggerFunction {
    CLUTCH,
    BRAKE,
    ACCELERATOR,
    RPM_CONTROL,
    /** Shift up one gear. */
    SHIFT_UP,
    /** Shift down one gear. */
    SHIFT_DOWN,
    INVALID;

    public static EngineTriggerFunction fromNumber(int number) {
        return (number >= 0 && number < INVALID.ordinal()) ? values()[number] : INVALID;
    }
}
