package com.rigdef.model.element;

/**
 * Per-node option characters of the "nodes" sections.
 */
public enum NodeOption {
    /** Node carries a load weight override. */
    LOAD_WEIGHT('l'),
    MOUSE_GRAB('n'),
    NO_MOUSE_GRAB('m'),
    NO_SPARKS('f'),
    EXHAUST_POINT('x'),
    EXHAUST_DIRECTION('y'),
    NO_GROUND_CONTACT('c'),
    HOOK_POINT('h'),
    TERRAIN_EDIT_POINT('e'),
    EXTRA_BUOYANCY('b'),
    NO_PARTICLES('p'),
    /** Log the node's state while simulating. */
    LOG('L');

    private final char code;

    NodeOption(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * @return the constant for the option character, or {@code null} if the character is unknown
     */
    public static NodeOption fromCode(char c) {
        for (NodeOption value : values()) {
            if (value.code == c) {
                return value;
            }
        }
        return null;
    }
}
