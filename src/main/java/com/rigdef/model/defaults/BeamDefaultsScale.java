package com.rigdef.model.defaults;

import lombok.Builder;
import lombok.Value;

/**
 * Multipliers applied to beam defaults, set by "set_beam_defaults_scale".
 */
@Value
@Builder(toBuilder = true)
public class BeamDefaultsScale {

    public static final BeamDefaultsScale IDENTITY = BeamDefaultsScale.builder().build();

    @Builder.Default
    float springiness = 1f;

    @Builder.Default
    float dampingConstant = 1f;

    @Builder.Default
    float deformationThresholdConstant = 1f;

    @Builder.Default
    float breakingThresholdConstant = 1f;
}
