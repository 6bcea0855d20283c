package com.rigdef.parser;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.Inertia;
import com.rigdef.model.element.WheelBraking;
import com.rigdef.model.element.WheelSide;
import com.rigdef.model.element.WingControl;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ArgumentReader.
 */
class ArgumentReaderTest {

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    private ArgumentReader reader(String... tokens) {
        DiagnosticsReporter reporter = new DiagnosticsReporter(diagnostics, "test.truck");
        return new ArgumentReader(new SplitArguments(List.of(tokens)), reporter,
                new NodeRefResolver(new SequentialImporter(true)));
    }

    @Test
    void testCheckCountReportsSingleWarning() {
        ArgumentReader args = reader("1", "2");

        assertThat(args.checkCount(2)).isTrue();
        assertThat(args.checkCount(5)).isFalse();

        assertThat(diagnostics.getWarnings()).containsExactly(
                "test.truck:0: Not enough arguments (got 2, 5 needed), skipping line");
        assertThat(diagnostics.getErrors()).isEmpty();
    }

    @Test
    void testIntArg() {
        ArgumentReader args = reader("12", "-3", "12abc", "abc");

        assertThat(args.intArg(0)).isEqualTo(12);
        assertThat(args.intArg(1)).isEqualTo(-3);
        assertThat(diagnostics.size()).isZero();

        assertThat(args.intArg(2)).isEqualTo(12);
        assertThat(diagnostics.getWarnings()).singleElement().asString()
                .contains("Integer argument [3] has invalid trailing characters");

        assertThat(args.intArg(3)).isZero();
        assertThat(diagnostics.getErrors()).singleElement().asString()
                .contains("Argument [4] is not valid integer");
    }

    @ParameterizedTest
    @CsvSource({
            "1.5, 1.5",
            "-0.25, -0.25",
            ".5, 0.5",
            "1e2, 100",
            "3.0x, 3.0"
    })
    void testFloatArgUsesLeadingNumber(String text, float expected) {
        assertThat(reader(text).floatArg(0)).isEqualTo(expected);
        assertThat(diagnostics.getErrors()).isEmpty();
    }

    @Test
    void testFloatArgInvalid() {
        assertThat(reader("abc").floatArg(0)).isZero();
        assertThat(diagnostics.getErrors()).singleElement().asString()
                .contains("Argument [1] is not valid number, using 0");
    }

    @ParameterizedTest
    @CsvSource({
            "true, true",
            "Yes, true",
            "1, true",
            "ON, true",
            "no, false",
            "0, false",
            "false, false"
    })
    void testBoolArg(String text, boolean expected) {
        assertThat(reader(text).boolArg(0)).isEqualTo(expected);
    }

    @Test
    void testSpecialNodeValues() {
        ArgumentReader args = reader("-1", "9999", "7");

        assertThat(args.nullableNode(0)).isNull();
        assertThat(args.rigidityNode(1)).isNull();
        NodeRef ref = args.nodeRef(2);
        assertThat(ref.getNumber()).isEqualTo(7);
        assertThat(ref.isAmbiguous()).isTrue();
    }

    @Test
    void testBrakingOutOfRangeFallsBack() {
        ArgumentReader args = reader("2", "9");

        assertThat(args.braking(0)).isEqualTo(WheelBraking.FOOT_HAND_SKID_LEFT);
        assertThat(args.braking(1)).isEqualTo(WheelBraking.NONE);
        assertThat(diagnostics.getErrors()).singleElement().asString()
                .contains("Bad value of param ~2 (braking), using 0 (not braked)");
    }

    @Test
    void testWheelSide() {
        ArgumentReader args = reader("r", "l", "x");

        assertThat(args.wheelSide(0)).isEqualTo(WheelSide.RIGHT);
        assertThat(args.wheelSide(1)).isEqualTo(WheelSide.LEFT);
        assertThat(args.wheelSide(2)).isEqualTo(WheelSide.LEFT);
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testWingSurface() {
        ArgumentReader args = reader("f", "ab", "z");

        assertThat(args.wingSurface(0)).isEqualTo(WingControl.FLAP);
        assertThat(args.wingSurface(1)).isEqualTo(WingControl.RIGHT_AILERON);
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("should be only 1 letter");
        assertThat(args.wingSurface(2)).isEqualTo(WingControl.NONE);
        assertThat(diagnostics.getErrors()).hasSize(1);
    }

    @Test
    void testManagedTexDash() {
        ArgumentReader args = reader("-", "paint.dds");

        assertThat(args.managedTex(0)).isEmpty();
        assertThat(args.managedTex(1)).isEqualTo("paint.dds");
    }

    @Test
    void testOptionalInertiaKeepsMissingValues() {
        Inertia base = Inertia.builder().startDelayFactor(9f).stopDelayFactor(8f).stopFunction("lin").build();

        Inertia partial = reader("x", "1.5").optionalInertia(base, 1);
        assertThat(partial.getStartDelayFactor()).isEqualTo(1.5f);
        assertThat(partial.getStopDelayFactor()).isEqualTo(8f);
        assertThat(partial.getStopFunction()).isEqualTo("lin");

        Inertia full = reader("x", "1.5", "2.5", "fn", "fn2").optionalInertia(base, 1);
        assertThat(full.getStopDelayFactor()).isEqualTo(2.5f);
        assertThat(full.getStartFunction()).isEqualTo("fn");
        assertThat(full.getStopFunction()).isEqualTo("fn2");
    }

    @Test
    void testLenientStaticConversions() {
        assertThat(ArgumentReader.parseInt("-7x")).isEqualTo(-7);
        assertThat(ArgumentReader.parseInt("x")).isZero();
        assertThat(ArgumentReader.parseInt(null)).isZero();
        assertThat(ArgumentReader.parseFloat("2.5;")).isEqualTo(2.5f);
        assertThat(ArgumentReader.parseFloat(null)).isZero();
        assertThat(ArgumentReader.parseBool(null)).isFalse();
    }
}
