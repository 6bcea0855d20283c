package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import lombok.Data;
import lombok.Value;

/**
 * Prop animation added by "add_animation".
 */
@Data
public class Animation {
    private float ratio;
    private float lowerLimit;
    private float upperLimit;
    private Set<AnimationMode> modes = EnumSet.noneOf(AnimationMode.class);
    private Set<AnimationSource> sources = EnumSet.noneOf(AnimationSource.class);
    private List<MotorSource> motorSources = new ArrayList<>();
    /** Input event name, upper case. */
    private String event = "";

    /**
     * Numbered aero engine source such as "throttle2".
     */
    @Value
    public static class MotorSource {
        AeroEngineSource source;
        int motor;
    }
}
