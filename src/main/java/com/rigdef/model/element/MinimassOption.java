package com.rigdef.model.element;

/**
 * Option of the "minimass" section.
 */
public enum MinimassOption {
    /** Skip nodes with load weight. */
    SKIP_LOADED('l'),
    DUMMY('n');

    private final char code;

    MinimassOption(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static MinimassOption fromCode(char c) {
        for (MinimassOption value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
