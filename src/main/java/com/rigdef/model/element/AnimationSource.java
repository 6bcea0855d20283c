package com.rigdef.model.element;

/**
 * Source values of "add_animation".
 */
public enum AnimationSource {
    AIRSPEED("airspeed"),
    VERTICAL_VELOCITY("vvi"),
    ALTIMETER_100K("altimeter100k"),
    ALTIMETER_10K("altimeter10k"),
    ALTIMETER_1K("altimeter1k"),
    ANGLE_OF_ATTACK("aoa"),
    FLAP("flap"),
    AIR_BRAKE("airbrake"),
    ROLL("roll"),
    PITCH("pitch"),
    BRAKES("brakes"),
    ACCEL("accel"),
    CLUTCH("clutch"),
    SPEEDO("speedo"),
    TACHO("tacho"),
    TURBO("turbo"),
    PARKING("parking"),
    SHIFT_LEFT_RIGHT("shifterman1"),
    SHIFT_BACK_FORTH("shifterman2"),
    SEQUENTIAL_SHIFT("sequential"),
    SHIFTERLIN("shifterlin"),
    TORQUE("torque"),
    HEADING("heading"),
    DIFFLOCK("difflock"),
    BOAT_RUDDER("rudderboat"),
    BOAT_THROTTLE("throttleboat"),
    STEERING_WHEEL("steeringwheel"),
    AILERON("aileron"),
    ELEVATOR("elevator"),
    AIR_RUDDER("rudderair"),
    PERMANENT("permanent"),
    EVENT("event");

    private final String token;

    AnimationSource(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static AnimationSource fromToken(String token) {
        for (AnimationSource value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        return null;
    }
}
