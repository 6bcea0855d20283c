package com.rigdef.model.element;

/**
 * Flag tokens of the "animators" section.
 */
public enum AnimatorOption {
    VISIBLE("vis"),
    INVISIBLE("inv"),
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
    GEAR_SELECT("shifterlin"),
    TORQUE("torque"),
    DIFFLOCK("difflock"),
    BOAT_RUDDER("rudderboat"),
    BOAT_THROTTLE("throttleboat"),
    SHORT_LIMIT("shortlimit"),
    LONG_LIMIT("longlimit");

    private final String token;

    AnimatorOption(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static AnimatorOption fromToken(String token) {
        for (AnimatorOption value : values()) {
            if (value.token.equals(token)) {
                return value;
            }
        }
        return null;
    }
}
