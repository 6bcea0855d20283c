package com.rigdef.model.element;

/**
 * Side a mesh wheel is mounted on.
 */
public enum WheelSide {
    LEFT('l'),
    RIGHT('r');

    private final char code;

    WheelSide(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static WheelSide fromCode(char c) {
        for (WheelSide value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
