package com.rigdef.model.element;

/**
 * Option characters of the "shocks2" section.
 */
public enum Shock2Option {
    INVISIBLE('i'),
    METRIC('m'),
    ABSOLUTE_METRIC('M'),
    SOFT_BUMP_BOUNDS('s');

    private final char code;

    Shock2Option(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static Shock2Option fromCode(char c) {
        for (Shock2Option value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
