package com.rigdef.model.defaults;

import lombok.Builder;
import lombok.Value;

/**
 * Beam defaults set by "set_beam_defaults" and "set_beam_defaults_scale". Immutable once published.
 */
@Value
@Builder(toBuilder = true)
public class BeamDefaults {

    public static final float DEFAULT_SPRING = 9000000f;
    public static final float DEFAULT_DAMP = 12000f;
    public static final float BEAM_DEFORM = 400000f;
    public static final float BEAM_BREAK = 1000000f;
    public static final float DEFAULT_BEAM_DIAMETER = 0.05f;
    public static final float BEAM_SKELETON_DIAMETER = 0.01f;
    public static final String DEFAULT_MATERIAL = "tracks/beam";

    public static final BeamDefaults BUILTIN = BeamDefaults.builder().build();

    @Builder.Default
    float springiness = DEFAULT_SPRING;

    @Builder.Default
    float dampingConstant = DEFAULT_DAMP;

    @Builder.Default
    float deformationThreshold = BEAM_DEFORM;

    @Builder.Default
    float breakingThreshold = BEAM_BREAK;

    @Builder.Default
    float visualBeamDiameter = DEFAULT_BEAM_DIAMETER;

    @Builder.Default
    String beamMaterialName = DEFAULT_MATERIAL;

    float plasticDeformCoef;

    /** Whether "enable_advanced_deformation" was active when these defaults were set. */
    boolean enableAdvancedDeformation;

    boolean userDefined;

    boolean plasticDeformCoefUserDefined;

    @Builder.Default
    BeamDefaultsScale scale = BeamDefaultsScale.IDENTITY;
}
