package com.rigdef.parser.extractor;

import org.junit.jupiter.api.Test;

import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.GeneratedNodeRange;
import com.rigdef.model.Module;
import com.rigdef.model.element.FlexBodyWheel;
import com.rigdef.model.element.MeshWheel;
import com.rigdef.model.element.Wheel;
import com.rigdef.model.element.WheelBraking;
import com.rigdef.model.element.WheelPropulsion;
import com.rigdef.model.element.WheelSide;
import com.rigdef.parser.RigDefParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WheelExtractors.
 */
class WheelExtractorsTest {

    private static final String NODES = """
            Rig
            nodes
            1, 0, 0, 0
            2, 0, 1, 0
            3, 1, 0, 0
            """;

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testWheel() {
        Module root = parse(NODES + """
                wheels
                0.5, 0.3, 12, 1, 2, 9999, 1, 1, 3, 100, 800000, 4000, face, band
                """);

        Wheel wheel = root.getWheels().get(0);
        assertThat(wheel.getRadius()).isEqualTo(0.5f);
        assertThat(wheel.getWidth()).isEqualTo(0.3f);
        assertThat(wheel.getNumRays()).isEqualTo(12);
        assertThat(wheel.getNode1().getNumber()).isEqualTo(1);
        assertThat(wheel.getNode2().getNumber()).isEqualTo(2);
        assertThat(wheel.getRigidityNode()).isNull();
        assertThat(wheel.getBraking()).isEqualTo(WheelBraking.FOOT_HAND);
        assertThat(wheel.getPropulsion()).isEqualTo(WheelPropulsion.FORWARD);
        assertThat(wheel.getReferenceArmNode().getNumber()).isEqualTo(3);
        assertThat(wheel.getMass()).isEqualTo(100f);
        assertThat(wheel.getSpringiness()).isEqualTo(800000f);
        assertThat(wheel.getFaceMaterialName()).isEqualTo("face");
        assertThat(wheel.getBandMaterialName()).isEqualTo("band");
        assertThat(wheel.getGeneratedNodes()).isEqualTo(new GeneratedNodeRange(4, 24));
        assertThat(diagnostics.size()).isZero();
    }

    @Test
    void testWheelWithTooFewArguments() {
        Module root = parse(NODES + """
                wheels
                0.5, 0.3, 12, 1, 2, 9999, 1, 1, 3, 100
                """);

        assertThat(root.getWheels()).isEmpty();
        assertThat(diagnostics.getWarnings()).containsExactly(
                "test.truck:7 (wheels): Not enough arguments (got 10, 14 needed), skipping line");
    }

    @Test
    void testConsecutiveWheelsNumberNodesInOrder() {
        Module root = parse(NODES + """
                wheels2
                0.3, 0.5, 0.2, 8, 1, 2, 9999, 0, 0, 3, 50, 1000, 10, 2000, 20, face, band
                meshwheels2
                0.5, 0.3, 0.2, 6, 1, 2, 9999, 0, 0, 3, 50, 1000, 10, r, wheel.mesh, tyre
                """);

        assertThat(root.getWheels2().get(0).getGeneratedNodes()).isEqualTo(new GeneratedNodeRange(4, 32));
        MeshWheel mesh = root.getMeshWheels().get(0);
        assertThat(mesh.isMeshwheel2()).isTrue();
        assertThat(mesh.getSide()).isEqualTo(WheelSide.RIGHT);
        assertThat(mesh.getMeshName()).isEqualTo("wheel.mesh");
        assertThat(mesh.getGeneratedNodes()).isEqualTo(new GeneratedNodeRange(36, 12));
    }

    @Test
    void testOversizedRayCountFallsBackToZero() {
        Module root = parse(NODES + """
                wheels2
                0.3, 0.5, 0.2, 1073741824, 1, 2, 9999, 0, 0, 3, 50, 1000, 10, 2000, 20, face, band
                0.3, 0.5, 0.2, 8, 1, 2, 9999, 0, 0, 3, 50, 1000, 10, 2000, 20, face, band
                """);

        assertThat(root.getWheels2().get(0).getNumRays()).isZero();
        assertThat(root.getWheels2().get(0).getGeneratedNodes()).isEqualTo(new GeneratedNodeRange(4, 0));
        assertThat(root.getWheels2().get(1).getGeneratedNodes()).isEqualTo(new GeneratedNodeRange(4, 32));
        assertThat(diagnostics.getWarnings()).containsExactly(
                "test.truck:7 (wheels2): Wheel has too many rays (1073741824), falling back to 0");
    }

    @Test
    void testFlexBodyWheelOptionalMeshes() {
        Module root = parse(NODES + """
                flexbodywheels
                0.5, 0.3, 0.2, 6, 1, 2, 9999, 2, 0, 3, 50, 1000, 10, 2000, 20, l
                0.5, 0.3, 0.2, 6, 1, 2, 9999, 2, 0, 3, 50, 1000, 10, 2000, 20, r, rim.mesh, tyre.mesh
                """);

        FlexBodyWheel plain = root.getFlexBodyWheels().get(0);
        assertThat(plain.getRimMeshName()).isEmpty();
        assertThat(plain.getBraking()).isEqualTo(WheelBraking.FOOT_HAND_SKID_LEFT);
        FlexBodyWheel meshed = root.getFlexBodyWheels().get(1);
        assertThat(meshed.getRimMeshName()).isEqualTo("rim.mesh");
        assertThat(meshed.getTyreMeshName()).isEqualTo("tyre.mesh");
        assertThat(meshed.getSide()).isEqualTo(WheelSide.RIGHT);
    }

    @Test
    void testInvalidBrakingFallsBack() {
        Module root = parse(NODES + """
                wheels
                0.5, 0.3, 12, 1, 2, 9999, 7, 5, 3, 100, 800000, 4000, face, band
                """);

        Wheel wheel = root.getWheels().get(0);
        assertThat(wheel.getBraking()).isEqualTo(WheelBraking.NONE);
        assertThat(wheel.getPropulsion()).isEqualTo(WheelPropulsion.NONE);
        assertThat(diagnostics.getErrors()).hasSize(2);
    }

    @Test
    void testWheelDetachers() {
        Module root = parse(NODES + """
                wheeldetachers
                0, 2
                """);

        assertThat(root.getWheelDetachers().get(0).getWheelId()).isZero();
        assertThat(root.getWheelDetachers().get(0).getDetacherGroup()).isEqualTo(2);
    }

    private Module parse(String text) {
        return new RigDefParser(diagnostics).parse(text.lines().toList(), "test.truck").getRootModule();
    }
}
