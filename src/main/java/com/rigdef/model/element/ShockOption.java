package com.rigdef.model.element;

/**
 * Option characters of the "shocks" section.
 */
public enum ShockOption {
    INVISIBLE('i'),
    /** Bounds are in meters instead of ratios. */
    METRIC('m'),
    ACTIVE_RIGHT('R'),
    ACTIVE_LEFT('L');

    private final char code;

    ShockOption(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static ShockOption fromCode(char c) {
        for (ShockOption value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
