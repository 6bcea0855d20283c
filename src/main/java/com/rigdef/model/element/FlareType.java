package com.rigdef.model.element;

/**
 * Flare types of the "flares" sections.
 */
public enum FlareType {
    HEADLIGHT('f'),
    BRAKE_LIGHT('b'),
    BLINKER_LEFT('l'),
    BLINKER_RIGHT('r'),
    REVERSE_LIGHT('R'),
    /** Toggled by a numbered user control. */
    USER('u'),
    /** Linked to a dashboard input. */
    DASHBOARD('d');

    private final char code;

    FlareType(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static FlareType fromCode(char c) {
        for (FlareType value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
