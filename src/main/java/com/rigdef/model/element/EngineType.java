package com.rigdef.model.element;

/**
 * Engine type of the "engoption" section.
 */
public enum EngineType {
    TRUCK('t'),
    CAR('c'),
    ELECTRIC_CAR('e');

    private final char code;

    EngineType(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static EngineType fromCode(char c) {
        for (EngineType value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
