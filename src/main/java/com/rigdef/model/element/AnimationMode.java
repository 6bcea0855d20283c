package com.rigdef.model.element;

/**
 * Mode values of "add_animation".
 */
public enum AnimationMode {
    ROTATION_X("x-rotation"),
    ROTATION_Y("y-rotation"),
    ROTATION_Z("z-rotation"),
    OFFSET_X("x-offset"),
    OFFSET_Y("y-offset"),
    OFFSET_Z("z-offset"),
    AUTO_ANIMATE("autoanimate"),
    NO_FLIP("noflip"),
    BOUNCE("bounce"),
    EVENT_LOCK("eventlock");

    private final String token;

    AnimationMode(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static AnimationMode fromToken(String token) {
        for (AnimationMode value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        return null;
    }
}
