package com.rigdef.model.defaults;

import lombok.Builder;
import lombok.Value;

/**
 * Inertia of a command, hydro, rotator or animator. Also used as the "set_inertia_defaults"
 * snapshot.
 */
@Value
@Builder(toBuilder = true)
public class Inertia {

    public static final Inertia BUILTIN = Inertia.builder().build();

    float startDelayFactor;
    float stopDelayFactor;

    @Builder.Default
    String startFunction = "";

    @Builder.Default
    String stopFunction = "";
}
