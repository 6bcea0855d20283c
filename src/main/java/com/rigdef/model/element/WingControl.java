package com.rigdef.model.element;

/**
 * Control surface types of the "wings" section.
 */
public enum WingControl {
    NONE('n'),
    RIGHT_AILERON('a'),
    LEFT_AILERON('b'),
    FLAP('f'),
    ELEVATOR('e'),
    RUDDER('r'),
    RIGHT_HAND_STABILATOR('S'),
    LEFT_HAND_STABILATOR('T'),
    RIGHT_ELEVON('c'),
    LEFT_ELEVON('d'),
    RIGHT_FLAPERON('g'),
    LEFT_FLAPERON('h'),
    RIGHT_HAND_TAILERON('U'),
    LEFT_HAND_TAILERON('V'),
    RIGHT_RUDDERVATOR('i'),
    LEFT_RUDDERVATOR('j');

    private final char code;

    WingControl(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static WingControl fromCode(char c) {
        for (WingControl value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
