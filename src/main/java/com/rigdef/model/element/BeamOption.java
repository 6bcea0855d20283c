package com.rigdef.model.element;

/**
 * Option characters of the "beams" section.
 */
public enum BeamOption {
    INVISIBLE('i'),
    ROPE('r'),
    /** Beam can only be compressed; stretching breaks it. */
    SUPPORT('s');

    private final char code;

    BeamOption(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static BeamOption fromCode(char c) {
        for (BeamOption value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
