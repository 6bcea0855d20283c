package com.rigdef.parser;

import java.util.Set;

import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.BeamDefaultsScale;
import com.rigdef.model.defaults.DefaultMinimass;
import com.rigdef.model.defaults.Inertia;
import com.rigdef.model.defaults.ManagedMaterialOptions;
import com.rigdef.model.defaults.NodeDefaults;
import com.rigdef.model.element.NodeOption;

import lombok.Getter;

/**
 * Defaults currently in effect. Each "set_*" directive publishes a new immutable snapshot;
 * elements keep a reference to the snapshot that was current when they were defined.
 */
@Getter
public class DefaultsStack {

    private NodeDefaults nodeDefaults = NodeDefaults.BUILTIN;
    private BeamDefaults beamDefaults = BeamDefaults.BUILTIN;
    private Inertia inertia = Inertia.BUILTIN;
    private ManagedMaterialOptions managedMaterialOptions = ManagedMaterialOptions.BUILTIN;

    /** {@code null} until "set_default_minimass" is used. */
    private DefaultMinimass defaultMinimass;

    /**
     * Negative values fall back to the builtin node defaults.
     */
    public NodeDefaults setNodeDefaults(float loadWeight, float friction, float volume, float surface,
                                        Set<NodeOption> options) {
        NodeDefaults builtin = NodeDefaults.BUILTIN;
        nodeDefaults = nodeDefaults.toBuilder()
                .loadWeight(loadWeight < 0 ? builtin.getLoadWeight() : loadWeight)
                .friction(friction < 0 ? builtin.getFriction() : friction)
                .volume(volume < 0 ? builtin.getVolume() : volume)
                .surface(surface < 0 ? builtin.getSurface() : surface)
                .options(Set.copyOf(options))
                .build();
        return nodeDefaults;
    }

    /**
     * Publishes user beam defaults. Negative values fall back to the builtin constants, except
     * the plastic deformation coefficient, which keeps the current value.
     *
     * @param plasticDeformCoef {@code null} when not given
     */
    public BeamDefaults setBeamDefaults(float springiness, Float dampingConstant, Float deformationThreshold,
                                        Float breakingThreshold, Float visualBeamDiameter, String materialName,
                                        Float plasticDeformCoef, boolean advancedDeformation) {
        BeamDefaults current = beamDefaults;
        BeamDefaults.BeamDefaultsBuilder b = current.toBuilder()
                .enableAdvancedDeformation(advancedDeformation)
                .userDefined(true)
                .springiness(springiness < 0 ? BeamDefaults.DEFAULT_SPRING : springiness);
        if (dampingConstant != null) {
            b.dampingConstant(dampingConstant < 0 ? BeamDefaults.DEFAULT_DAMP : dampingConstant);
        }
        if (deformationThreshold != null) {
            b.deformationThreshold(deformationThreshold < 0 ? BeamDefaults.BEAM_DEFORM : deformationThreshold);
        }
        if (breakingThreshold != null) {
            b.breakingThreshold(breakingThreshold < 0 ? BeamDefaults.BEAM_BREAK : breakingThreshold);
        }
        if (visualBeamDiameter != null) {
            b.visualBeamDiameter(visualBeamDiameter < 0 ? BeamDefaults.DEFAULT_BEAM_DIAMETER : visualBeamDiameter);
        }
        if (materialName != null) {
            b.beamMaterialName(materialName);
        }
        if (plasticDeformCoef != null) {
            if (plasticDeformCoef >= 0) {
                b.plasticDeformCoef(plasticDeformCoef).plasticDeformCoefUserDefined(true);
            } else {
                b.plasticDeformCoef(current.getPlasticDeformCoef());
            }
        }
        beamDefaults = b.build();
        return beamDefaults;
    }

    /**
     * Scale values are taken over from the current user snapshot where not given.
     */
    public BeamDefaults setBeamDefaultsScale(float springiness, Float damping, Float deformation, Float breaking) {
        BeamDefaultsScale.BeamDefaultsScaleBuilder s = beamDefaults.getScale().toBuilder().springiness(springiness);
        if (damping != null) {
            s.dampingConstant(damping);
        }
        if (deformation != null) {
            s.deformationThresholdConstant(deformation);
        }
        if (breaking != null) {
            s.breakingThresholdConstant(breaking);
        }
        beamDefaults = beamDefaults.toBuilder().scale(s.build()).build();
        return beamDefaults;
    }

    /**
     * A negative delay resets to the builtin inertia; otherwise the new snapshot is derived from
     * the current one.
     */
    public Inertia setInertiaDefaults(float startDelay, float stopDelay, String startFunction, String stopFunction) {
        if (startDelay < 0 || stopDelay < 0) {
            inertia = Inertia.BUILTIN;
            return inertia;
        }
        Inertia.InertiaBuilder b = inertia.toBuilder()
                .startDelayFactor(startDelay)
                .stopDelayFactor(stopDelay);
        if (startFunction != null) {
            b.startFunction(startFunction);
        }
        if (stopFunction != null) {
            b.stopFunction(stopFunction);
        }
        inertia = b.build();
        return inertia;
    }

    public void setManagedMaterialOptions(ManagedMaterialOptions options) {
        this.managedMaterialOptions = options;
    }

    public void setDefaultMinimass(DefaultMinimass minimass) {
        this.defaultMinimass = minimass;
    }
}
