package com.rigdef.model.element;

/**
 * Option characters of the "shocks3" section.
 */
public enum Shock3Option {
    INVISIBLE('i'),
    METRIC('m'),
    ABSOLUTE_METRIC('M');

    private final char code;

    Shock3Option(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static Shock3Option fromCode(char c) {
        for (Shock3Option value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
