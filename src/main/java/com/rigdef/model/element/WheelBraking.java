package com.rigdef.model.element;

/**
 * Braking mode of a wheel, written as a number 0-4.
 */
public enum WheelBraking {
    NONE,
    FOOT_HAND,
    FOOT_HAND_SKID_LEFT,
    FOOT_HAND_SKID_RIGHT,
    FOOT_ONLY;

    /**
     * @return the braking mode for the number, or {@code null} when out of range
     */
    public static WheelBraking fromNumber(int number) {
        WheelBraking[] values = values();
        return (number >= 0 && number < values.length) ? values[number] : null;
    }
}
