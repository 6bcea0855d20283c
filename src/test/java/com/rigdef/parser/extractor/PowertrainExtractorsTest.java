package com.rigdef.parser.extractor;

import org.junit.jupiter.api.Test;

import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.Module;
import com.rigdef.model.element.AntiLockBrakes;
import com.rigdef.model.element.Axle;
import com.rigdef.model.element.DifferentialType;
import com.rigdef.model.element.EngineType;
import com.rigdef.model.element.Engoption;
import com.rigdef.model.element.Engturbo;
import com.rigdef.model.element.TorqueCurve;
import com.rigdef.model.element.TractionControl;
import com.rigdef.model.element.TransferCase;
import com.rigdef.parser.RigDefParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PowertrainExtractors.
 */
class PowertrainExtractorsTest {

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testEngineGearsStopAtTerminator() {
        Module root = parse("""
                Rig
                engine
                2000, 3500, 800, 4.0, 3.5, 1.0, 3, 2, 1, -1.0, 7
                """);

        assertThat(root.getEngines()).hasSize(1);
        assertThat(root.getEngines().get(0).getShiftUpRpm()).isEqualTo(3500f);
        assertThat(root.getEngines().get(0).getGearRatios()).containsExactly(3f, 2f, 1f);
        assertThat(diagnostics.size()).isZero();
    }

    @Test
    void testEngineWithoutForwardGearIsRejected() {
        Module root = parse("""
                Rig
                engine
                2000, 3500, 800, 4.0, 3.5, 1.0
                """);

        assertThat(root.getEngines()).isEmpty();
        assertThat(diagnostics.getErrors()).singleElement().asString().endsWith("no forward gear");
    }

    @Test
    void testEngoption() {
        Module root = parse("""
                Rig
                engoption
                5.0, c, 10000
                2.0, x
                """);

        Engoption car = root.getEngoptions().get(0);
        assertThat(car.getType()).isEqualTo(EngineType.CAR);
        assertThat(car.getClutchForce()).isEqualTo(10000f);
        assertThat(car.getShiftTime()).isEqualTo(-1f);
        assertThat(root.getEngoptions().get(1).getType()).isEqualTo(EngineType.TRUCK);
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("Invalid engine type 'x'");
    }

    @Test
    void testEngturboLimitsTurboCount() {
        Module root = parse("""
                Rig
                engturbo
                2, 1.0, 6, 1, 2, 3
                """);

        Engturbo turbo = root.getEngturbos().get(0);
        assertThat(turbo.getNturbos()).isEqualTo(Engturbo.MAX_TURBOS);
        assertThat(turbo.getParameters()).containsExactly(1f, 2f, 3f);
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("more than 4 turbos");
    }

    @Test
    void testTorqueCurveSamplesAndName() {
        Module root = parse("""
                Rig
                torquecurve
                0, 0
                1000, 50
                3000, 100
                turbodiesel
                """);

        assertThat(root.getTorqueCurves()).hasSize(1);
        TorqueCurve curve = root.getTorqueCurves().get(0);
        assertThat(curve.getSamples()).containsExactly(
                new TorqueCurve.Sample(0f, 0f),
                new TorqueCurve.Sample(1000f, 50f),
                new TorqueCurve.Sample(3000f, 100f));
        assertThat(curve.getPredefinedFuncName()).isEqualTo("turbodiesel");
    }

    @Test
    void testAxles() {
        Module root = parse("""
                Rig
                axles
                w1(1 2), w2(3 4), d(lo)
                w1(1 2), x(5)
                """);

        assertThat(root.getAxles()).hasSize(1);
        Axle axle = root.getAxles().get(0);
        assertThat(axle.getWheel1()[0].getText()).isEqualTo("1");
        assertThat(axle.getWheel1()[1].getText()).isEqualTo("2");
        assertThat(axle.getWheel2()[0].getText()).isEqualTo("3");
        assertThat(axle.getWheel2()[1].getText()).isEqualTo("4");
        assertThat(axle.getOptions()).containsExactly(DifferentialType.LOCKED, DifferentialType.OPEN);
        assertThat(diagnostics.getErrors()).singleElement().asString().contains("Invalid property");
    }

    @Test
    void testInterAxlesAndTransferCaseUseZeroBasedIndices() {
        Module root = parse("""
                Rig
                interaxles
                1, 2, d(ls)
                transfercase
                1, 2, 1, 0, 1.0, 2.5
                """);

        assertThat(root.getInterAxles().get(0).getA1()).isZero();
        assertThat(root.getInterAxles().get(0).getA2()).isEqualTo(1);
        assertThat(root.getInterAxles().get(0).getOptions())
                .containsExactly(DifferentialType.LOCKED, DifferentialType.SPLIT);
        TransferCase transferCase = root.getTransferCases().get(0);
        assertThat(transferCase.getA1()).isZero();
        assertThat(transferCase.getA2()).isEqualTo(1);
        assertThat(transferCase.isHas2wd()).isTrue();
        assertThat(transferCase.isHas2wdLo()).isFalse();
        assertThat(transferCase.getGearRatios()).containsExactly(1.0f, 2.5f);
    }

    @Test
    void testDriverAids() {
        Module root = parse("""
                Rig
                TractionControl 1000, 10, 2, 5, mode: nodash & off
                AntiLockBrakes 200, 30, 10, mode: notoggle
                """);

        TractionControl tc = root.getTractionControls().get(0);
        assertThat(tc.getRegulationForce()).isEqualTo(1000f);
        assertThat(tc.getWheelSlip()).isEqualTo(10f);
        assertThat(tc.getPulsePerSec()).isEqualTo(5f);
        assertThat(tc.isNoDashboard()).isTrue();
        assertThat(tc.isOn()).isFalse();

        AntiLockBrakes alb = root.getAntiLockBrakes().get(0);
        assertThat(alb.getMinSpeed()).isEqualTo(30);
        assertThat(alb.isNoToggle()).isTrue();
        assertThat(alb.isOn()).isTrue();
        assertThat(diagnostics.size()).isZero();
    }

    @Test
    void testDriverAidWithoutModeKeyword() {
        Module root = parse("""
                Rig
                TractionControl 1000, 10, 2, 5, nodash
                """);

        assertThat(root.getTractionControls()).hasSize(1);
        assertThat(root.getTractionControls().get(0).isNoDashboard()).isFalse();
        assertThat(diagnostics.getErrors()).singleElement().asString().endsWith("missing mode");
    }

    @Test
    void testCruiseControlAndSpeedLimiter() {
        Module root = parse("""
                Rig
                cruisecontrol 5.0, 1
                speedlimiter 30
                """);

        assertThat(root.getCruiseControls().get(0).getMinSpeed()).isEqualTo(5f);
        assertThat(root.getCruiseControls().get(0).getAutobrake()).isEqualTo(1);
        assertThat(root.getSpeedLimiters().get(0).isEnabled()).isTrue();
        assertThat(root.getSpeedLimiters().get(0).getMaxSpeed()).isEqualTo(30f);
    }

    private Module parse(String text) {
        return new RigDefParser(diagnostics).parse(text.lines().toList(), "test.truck").getRootModule();
    }
}
