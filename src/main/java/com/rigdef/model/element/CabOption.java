package com.rigdef.model.element;

/**
 * Option characters of the "cab" section.
 */
public enum CabOption {
    CONTACT('c'),
    BUOYANT('b'),
    TOUGHER_10X('p'),
    INVULNERABLE('u');

    private final char code;

    CabOption(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static CabOption fromCode(char c) {
        for (CabOption value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
