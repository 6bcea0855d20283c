package com.rigdef.model.element;

import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

/**
 * Skeleton view settings.
 */
@Data
public class SkeletonSettings {
    public static final float DEFAULT_VISIBILITY_RANGE = 150f;

    private float visibilityRangeMeters = DEFAULT_VISIBILITY_RANGE;
    private float beamThicknessMeters = BeamDefaults.BEAM_SKELETON_DIAMETER;
}
