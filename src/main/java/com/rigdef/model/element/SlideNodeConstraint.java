package com.rigdef.model.element;

/**
 * Attachment constraints of the "slidenodes" section ("C" prefix).
 */
public enum SlideNodeConstraint {
    ATTACH_ALL('a'),
    /** Attach only to rails of other vehicles. */
    ATTACH_FOREIGN('f'),
    /** Attach only to rails of the same vehicle. */
    ATTACH_SELF('s'),
    ATTACH_NONE('n');

    private final char code;

    SlideNodeConstraint(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static SlideNodeConstraint fromCode(char c) {
        for (SlideNodeConstraint value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
