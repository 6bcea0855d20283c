package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.Inertia;

import lombok.Data;

/**
 * Beam whose length follows a vehicle input.
 */
@Data
public class Animator {
    private NodeRef node1;
    private NodeRef node2;
    private float lengtheningFactor;
    private Set<AnimatorOption> flags = EnumSet.noneOf(AnimatorOption.class);
    private float shortLimit;
    private float longLimit;

    /** Aero engine input, for animators driven by "throttleN", "rpmN" and similar. */
    private Set<AeroEngineSource> aeroFlags = EnumSet.noneOf(AeroEngineSource.class);
    private int aeroEngineIndex;

    private Inertia inertiaDefaults;
    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
