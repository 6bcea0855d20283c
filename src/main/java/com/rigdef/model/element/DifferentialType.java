package com.rigdef.model.element;

/**
 * Differential types of "axles" and "interaxles".
 */
public enum DifferentialType {
    OPEN('o'),
    LOCKED('l'),
    SPLIT('s'),
    VISCOUS('v');

    private final char code;

    DifferentialType(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static DifferentialType fromCode(char c) {
        for (DifferentialType value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
