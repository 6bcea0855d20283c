package com.rigdef.model.element;

/**
 * Option characters of the "triggers" section.
 */
public enum TriggerOption {
    INVISIBLE('i'),
    COMMAND_STYLE('c'),
    START_OFF('x'),
    BLOCK_KEYS('b'),
    BLOCK_TRIGGERS('B'),
    INV_BLOCK_TRIGGERS('A'),
    SWITCH_CMD_NUM('s'),
    UNLOCK_HOOKGROUPS_KEY('h'),
    LOCK_HOOKGROUPS_KEY('H'),
    CONTINUOUS('t'),
    ENGINE_TRIGGER('E');

    private final char code;

    TriggerOption(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static TriggerOption fromCode(char c) {
        for (TriggerOption value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
