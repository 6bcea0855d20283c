package com.rigdef.parser.extractor;

import org.junit.jupiter.api.Test;

import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.CameraSettings;
import com.rigdef.model.Module;
import com.rigdef.model.NodeRange;
import com.rigdef.model.Vector3;
import com.rigdef.model.element.AeroEngineSource;
import com.rigdef.model.element.Animation;
import com.rigdef.model.element.AnimationMode;
import com.rigdef.model.element.AnimationSource;
import com.rigdef.model.element.CabOption;
import com.rigdef.model.element.ExtCameraMode;
import com.rigdef.model.element.Flare;
import com.rigdef.model.element.FlareType;
import com.rigdef.model.element.ManagedMaterial;
import com.rigdef.model.element.ManagedMaterialType;
import com.rigdef.model.element.Prop;
import com.rigdef.model.element.PropSpecial;
import com.rigdef.model.element.SoundSource2;
import com.rigdef.model.element.Submesh;
import com.rigdef.parser.ParserConfig;
import com.rigdef.parser.RigDefParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VisualExtractors.
 */
class VisualExtractorsTest {

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testPropSpecials() {
        Module root = parse("""
                Rig
                props
                1, 2, 3, 0.1, 0.2, 0.3, 0, 90, 0, dashboard.mesh, needle.mesh, 0.1, 0.2, 0.3, 45
                1, 2, 3, 0, 0, 0, 0, 0, 0, beacon.mesh, beaconflare, 1, 0.5, 0
                1, 2, 3, 0, 0, 0, 0, 0, 0, seat.mesh
                """);

        Prop dashboard = root.getProps().get(0);
        assertThat(dashboard.getSpecial()).isEqualTo(PropSpecial.DASHBOARD_LEFT);
        assertThat(dashboard.getOffset()).isEqualTo(new Vector3(0.1f, 0.2f, 0.3f));
        assertThat(dashboard.getDashboard().getMeshName()).isEqualTo("needle.mesh");
        assertThat(dashboard.getDashboard().isOffsetSet()).isTrue();
        assertThat(dashboard.getDashboard().getRotationAngle()).isEqualTo(45f);

        Prop beacon = root.getProps().get(1);
        assertThat(beacon.getSpecial()).isEqualTo(PropSpecial.BEACON);
        assertThat(beacon.getBeacon().getFlareMaterialName()).isEqualTo("beaconflare");
        assertThat(beacon.getBeacon().getGreen()).isEqualTo(0.5f);

        Prop seat = root.getProps().get(2);
        assertThat(seat.getSpecial()).isEqualTo(PropSpecial.DRIVER_SEAT);
        assertThat(seat.getBeacon()).isNull();
        assertThat(seat.getDashboard()).isNull();
    }

    @Test
    void testAddAnimation() {
        Module root = parse("""
                Rig
                props
                1, 2, 3, 0, 0, 0, 0, 0, 0, needle.mesh
                add_animation 0.5, 0, 100, source: tacho|throttle2, mode: x-rotation|bounce, autoanimate, event: truck_horn
                """);

        Animation animation = root.getProps().get(0).getAnimations().get(0);
        assertThat(animation.getRatio()).isEqualTo(0.5f);
        assertThat(animation.getUpperLimit()).isEqualTo(100f);
        assertThat(animation.getSources()).containsExactly(AnimationSource.TACHO);
        assertThat(animation.getMotorSources()).containsExactly(
                new Animation.MotorSource(AeroEngineSource.THROTTLE, 2));
        assertThat(animation.getModes()).containsExactlyInAnyOrder(AnimationMode.ROTATION_X, AnimationMode.AUTO_ANIMATE);
        assertThat(animation.getEvent()).isEqualTo("TRUCK_HORN");
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("Invalid 'mode': bounce");
    }

    @Test
    void testPropDirectivesWithoutPropAreErrors() {
        parse("""
                Rig
                add_animation 0.5, 0, 100, source: tacho
                prop_camera_mode 1
                forset 1-3
                """);

        assertThat(diagnostics.getErrors()).hasSize(3);
        assertThat(diagnostics.getErrors().get(0)).contains("No prop defined to apply 'add_animation' to");
        assertThat(diagnostics.getErrors().get(1)).contains("No prop defined to apply 'prop_camera_mode' to");
        assertThat(diagnostics.getErrors().get(2)).contains("No flexbody defined to apply 'forset' to");
    }

    @Test
    void testCameraModesApplyToLastPropAndFlexbody() {
        Module root = parse("""
                Rig
                props
                1, 2, 3, 0, 0, 0, 0, 0, 0, first.mesh
                1, 2, 3, 0, 0, 0, 0, 0, 0, second.mesh
                prop_camera_mode 2
                flexbodies
                1, 2, 3, 0, 0, 0, 0, 0, 0, body.mesh
                flexbody_camera_mode -1
                flexbody_camera_mode -5
                """);

        assertThat(root.getProps().get(0).getCameraSettings().getMode()).isEqualTo(CameraSettings.Mode.ALWAYS);
        CameraSettings second = root.getProps().get(1).getCameraSettings();
        assertThat(second.getMode()).isEqualTo(CameraSettings.Mode.CINECAM);
        assertThat(second.getCinecamIndex()).isEqualTo(2);
        assertThat(root.getFlexbodies().get(0).getCameraSettings().getMode()).isEqualTo(CameraSettings.Mode.EXTERNAL);
        assertThat(diagnostics.getErrors()).singleElement().asString().contains("invalid value (-5)");
    }

    @Test
    void testForsetRanges() {
        Module root = parse("""
                Rig
                flexbodies
                1, 2, 3, 0, 0, 0, 0, 0, 0, body.mesh
                forset 1-5, 8, 10-12
                """);

        assertThat(root.getFlexbodies().get(0).getNodeListToImport()).hasSize(3);
        NodeRange first = root.getFlexbodies().get(0).getNodeListToImport().get(0);
        assertThat(first.getStart().getNumber()).isEqualTo(1);
        assertThat(first.getEnd().getNumber()).isEqualTo(5);
        NodeRange single = root.getFlexbodies().get(0).getNodeListToImport().get(1);
        assertThat(single.isSingle()).isTrue();
        assertThat(single.getStart().getText()).isEqualTo("8");
        assertThat(root.getFlexbodies().get(0).getNodeListToImport().get(2).getEnd().getNumber()).isEqualTo(12);
    }

    @Test
    void testFlares() {
        Module root = parse("""
                Rig
                flares
                1, 2, 3, 0.5, 0.5
                1, 2, 3, 0, 0, d, brakes
                flares2
                1, 2, 3, 0.5, 0.5, 0.2, u, 3, 500, 1.5, flaremat
                """);

        Flare plain = root.getFlares().get(0);
        assertThat(plain.getOffset()).isEqualTo(new Vector3(0.5f, 0.5f, 1f));
        assertThat(plain.getType()).isEqualTo(FlareType.HEADLIGHT);
        assertThat(root.getFlares().get(1).getType()).isEqualTo(FlareType.DASHBOARD);
        assertThat(root.getFlares().get(1).getDashboardLink()).isEqualTo("brakes");

        Flare user = root.getFlares().get(2);
        assertThat(user.getOffset().getZ()).isEqualTo(0.2f);
        assertThat(user.getType()).isEqualTo(FlareType.USER);
        assertThat(user.getControlNumber()).isEqualTo(3);
        assertThat(user.getBlinkDelayMillis()).isEqualTo(500);
        assertThat(user.getSize()).isEqualTo(1.5f);
        assertThat(user.getMaterialName()).isEqualTo("flaremat");
    }

    @Test
    void testManagedMaterialsCheckTextures() {
        ParserConfig config = ParserConfig.builder()
                .resourceLocator((group, name) -> !name.equals("missing.dds"))
                .build();
        Module root = new RigDefParser(config, diagnostics).parse("""
                Rig
                set_managedmaterials_options 1
                managedmaterials
                mat1 mesh_standard diffuse.dds spec.dds
                mat2 flexmesh_standard diffuse.dds - missing.dds
                mat3 bogus_effect diffuse.dds
                mat4 mesh_standard missing.dds
                """.lines().toList(), "test.truck").getRootModule();

        assertThat(root.getManagedMaterials()).extracting(ManagedMaterial::getName)
                .containsExactly("mat1", "mat2", "mat4");
        ManagedMaterial standard = root.getManagedMaterials().get(0);
        assertThat(standard.getType()).isEqualTo(ManagedMaterialType.MESH_STANDARD);
        assertThat(standard.getSpecularMap()).isEqualTo("spec.dds");
        assertThat(standard.getOptions().isDoubleSided()).isTrue();

        ManagedMaterial flex = root.getManagedMaterials().get(1);
        assertThat(flex.hasDamagedDiffuseMap()).isFalse();
        assertThat(flex.getDamagedDiffuseMap()).isEmpty();
        assertThat(flex.getSpecularMap()).isEmpty();

        ManagedMaterial missingDiffuse = root.getManagedMaterials().get(2);
        assertThat(missingDiffuse.getType()).isEqualTo(ManagedMaterialType.MESH_STANDARD);
        assertThat(missingDiffuse.getDiffuseMap()).isEmpty();
        assertThat(diagnostics.getWarnings()).containsExactly(
                "test.truck:5 (managedmaterials): Missing texture file: missing.dds",
                "test.truck:6 (managedmaterials): bogus_effect is an unknown effect",
                "test.truck:7 (managedmaterials): Missing texture file: missing.dds");
    }

    @Test
    void testSubmeshCollectsTexcoordsAndCabs() {
        Module root = parse("""
                Rig
                submesh
                texcoords
                1, 0.1, 0.2
                cab
                1, 2, 3, cD
                1, 2, 3, z
                backmesh
                submesh
                cab
                4, 5, 6
                """);

        assertThat(root.getSubmeshes()).hasSize(2);
        Submesh first = root.getSubmeshes().get(0);
        assertThat(first.isBackmesh()).isTrue();
        assertThat(first.getTexcoords()).hasSize(1);
        assertThat(first.getTexcoords().get(0).getV()).isEqualTo(0.2f);
        assertThat(first.getCabTriangles()).hasSize(2);
        assertThat(first.getCabTriangles().get(0).getOptions()).containsExactlyInAnyOrder(CabOption.CONTACT, CabOption.BUOYANT);
        assertThat(first.getCabTriangles().get(1).getOptions()).isEmpty();
        assertThat(root.getSubmeshes().get(1).isBackmesh()).isFalse();
        assertThat(root.getSubmeshes().get(1).getCabTriangles()).hasSize(1);
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testSubmeshContentWithoutSubmesh() {
        Module root = parse("""
                Rig
                texcoords
                1, 0.1, 0.2
                backmesh
                """);

        assertThat(root.getSubmeshes()).isEmpty();
        assertThat(diagnostics.getErrors()).containsExactly(
                "test.truck:3 (texcoords): must come after 'submesh', ignoring line",
                "test.truck:4 (backmesh): must come after 'submesh'");
    }

    @Test
    void testSoundSources2Modes() {
        Module root = parse("""
                Rig
                soundsources2
                1, -1, engine_sound
                1, 3, horn_sound
                1, -7, other_sound
                """);

        assertThat(root.getSoundSources2()).extracting(SoundSource2::getMode).containsExactly(
                SoundSource2.Mode.OUTSIDE, SoundSource2.Mode.CINECAM, SoundSource2.Mode.ALWAYS);
        assertThat(root.getSoundSources2().get(1).getCinecamIndex()).isEqualTo(3);
        assertThat(root.getSoundSources2().get(0).getSoundScriptName()).isEqualTo("engine_sound");
        assertThat(diagnostics.getErrors()).singleElement().asString().contains("invalid mode -7");
    }

    @Test
    void testExtCamera() {
        Module root = parse("""
                Rig
                extcamera node 5
                extcamera weird
                extcamera node
                """);

        assertThat(root.getExtCameras()).hasSize(1);
        assertThat(root.getExtCameras().get(0).getMode()).isEqualTo(ExtCameraMode.NODE);
        assertThat(root.getExtCameras().get(0).getNode().getText()).isEqualTo("5");
        assertThat(diagnostics.getWarnings()).hasSize(2);
    }

    @Test
    void testExhaustsAndParticles() {
        Module root = parse("""
                Rig
                exhausts
                1, 2, 0, tracks_smoke
                particles
                3, 4, water_spray
                """);

        assertThat(root.getExhausts().get(0).getParticleName()).isEqualTo("tracks_smoke");
        assertThat(root.getParticles().get(0).getParticleSystemName()).isEqualTo("water_spray");
    }

    private Module parse(String text) {
        return new RigDefParser(diagnostics).parse(text.lines().toList(), "test.truck").getRootModule();
    }
}
