package com.rigdef.model.element;

/**
 * Modes of the "extcamera" directive.
 */
public enum ExtCameraMode {
    CLASSIC("classic"),
    CINECAM("cinecam"),
    NODE("node");

    private final String token;

    ExtCameraMode(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static ExtCameraMode fromToken(String token) {
        for (ExtCameraMode value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        return null;
    }
}
