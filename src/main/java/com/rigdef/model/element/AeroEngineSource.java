package com.rigdef.model.element;

/**
 * Numbered aero engine inputs ("throttle1", "rpm2", ...) of animators and prop animations.
 */
public enum AeroEngineSource {
    THROTTLE("throttle"),
    RPM("rpm"),
    TORQUE("aerotorq"),
    PITCH("aeropit"),
    STATUS("aerostatus");

    private final String token;

    AeroEngineSource(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static AeroEngineSource fromToken(String token) {
        for (AeroEngineSource value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        return null;
    }
}
