package com.rigdef.parser;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.Inertia;
import com.rigdef.model.element.FlareType;
import com.rigdef.model.element.MinimassOption;
import com.rigdef.model.element.WheelBraking;
import com.rigdef.model.element.WheelPropulsion;
import com.rigdef.model.element.WheelSide;
import com.rigdef.model.element.WingControl;

/**
 * Typed access to the arguments of the current line.
 *
 * Conversion problems are reported and replaced by a fallback value so the line can still be
 * committed. Indices are zero-based; messages use one-based argument numbers.
 */
public class ArgumentReader {

    private static final Pattern FLOAT_PREFIX = Pattern.compile(
            "^\\s*[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Pattern INT_PREFIX = Pattern.compile("^\\s*([+-]?\\d+)");

    private static final String WING_CONTROL_LEGAL_FLAGS = "nabferSTcdghUVij";

    private final Arguments arguments;
    private final DiagnosticsReporter reporter;
    private final NodeRefResolver nodeRefs;

    public ArgumentReader(Arguments arguments, DiagnosticsReporter reporter, NodeRefResolver nodeRefs) {
        this.arguments = arguments;
        this.reporter = reporter;
        this.nodeRefs = nodeRefs;
    }

    public int count() {
        return arguments.count();
    }

    public boolean has(int index) {
        return index < arguments.count();
    }

    /**
     * Reports a warning when fewer than {@code min} arguments are present.
     *
     * @return {@code true} when the line may be processed
     */
    public boolean checkCount(int min) {
        if (arguments.count() < min) {
            reporter.warning(String.format("Not enough arguments (got %d, %d needed), skipping line",
                    arguments.count(), min));
            return false;
        }
        return true;
    }

    public String str(int index) {
        return arguments.get(index);
    }

    public char ch(int index) {
        String s = arguments.get(index);
        return s.isEmpty() ? '\0' : s.charAt(0);
    }

    public int intArg(int index) {
        String s = arguments.get(index);
        Matcher m = INT_PREFIX.matcher(s);
        if (!m.find()) {
            reporter.error(String.format("Argument [%d] is not valid integer", index + 1));
            return 0;
        }
        long value;
        try {
            value = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            reporter.error(String.format("Cannot parse argument [%d] as integer, value out of range", index + 1));
            return 0;
        }
        if (m.end() != s.length()) {
            reporter.warning(String.format("Integer argument [%d] has invalid trailing characters", index + 1));
        }
        return (int) value;
    }

    public float floatArg(int index) {
        String s = arguments.get(index);
        Matcher m = FLOAT_PREFIX.matcher(s);
        if (!m.find()) {
            reporter.error(String.format("Argument [%d] is not valid number, using 0", index + 1));
            return 0f;
        }
        return Float.parseFloat(m.group().trim());
    }

    /**
     * True when the value starts with "true", "yes", "1" or "on", in any case.
     */
    public boolean boolArg(int index) {
        return parseBool(arguments.get(index));
    }

    public NodeRef nodeRef(int index) {
        return nodeRefs.resolve(arguments.get(index));
    }

    /**
     * @return {@code null} when the argument is {@code -1}
     */
    public NodeRef nullableNode(int index) {
        if (parseFloat(arguments.get(index)) == -1f) {
            return null;
        }
        return nodeRef(index);
    }

    /**
     * @return {@code null} for the special value "9999"
     */
    public NodeRef rigidityNode(int index) {
        if ("9999".equals(arguments.get(index))) {
            return null;
        }
        return nodeRef(index);
    }

    public WheelBraking braking(int index) {
        WheelBraking braking = WheelBraking.fromNumber(intArg(index));
        if (braking == null) {
            reporter.error(String.format("Bad value of param ~%d (braking), using 0 (not braked)", index + 1));
            return WheelBraking.NONE;
        }
        return braking;
    }

    public WheelPropulsion propulsion(int index) {
        WheelPropulsion propulsion = WheelPropulsion.fromNumber(intArg(index));
        if (propulsion == null) {
            reporter.error(String.format("Bad value of param ~%d (propulsion), using 0 (no propulsion)", index + 1));
            return WheelPropulsion.NONE;
        }
        return propulsion;
    }

    public WheelSide wheelSide(int index) {
        char c = ch(index);
        if (c == 'r') {
            return WheelSide.RIGHT;
        }
        if (c != 'l') {
            reporter.warning(String.format(
                    "Bad arg~%d 'side' (value: %c), parsing as 'l' for backwards compatibility.", index + 1, c));
        }
        return WheelSide.LEFT;
    }

    public FlareType flareType(int index) {
        char c = ch(index);
        FlareType type = FlareType.fromCode(c);
        if (type == null) {
            reporter.warning(String.format("Invalid flare type '%c', falling back to type 'f' (front light)...", c));
            return FlareType.HEADLIGHT;
        }
        return type;
    }

    public WingControl wingSurface(int index) {
        String s = arguments.get(index);
        if (s.isEmpty() || WING_CONTROL_LEGAL_FLAGS.indexOf(s.charAt(0)) < 0) {
            reporter.error(String.format(
                    "Invalid argument ~%d 'control surface' (value: %s), allowed are: <%s>, ignoring...",
                    index + 1, s, WING_CONTROL_LEGAL_FLAGS));
            return WingControl.NONE;
        }
        if (s.length() > 1) {
            reporter.warning(String.format(
                    "Argument ~%d 'control surface' (value: %s), should be only 1 letter.", index + 1, s));
        }
        return WingControl.fromCode(s.charAt(0));
    }

    /**
     * Texture name of a managed material; "-" means none.
     */
    public String managedTex(int index) {
        String s = arguments.get(index);
        return s.startsWith("-") ? "" : s;
    }

    public MinimassOption minimassOption(int index) {
        String s = arguments.get(index);
        MinimassOption option = s.isEmpty() ? null : MinimassOption.fromCode(s.charAt(0));
        if (option == null) {
            reporter.warning(String.format("Not a valid minimass option: %s, falling back to 'n' (dummy)", s));
            return MinimassOption.DUMMY;
        }
        return option;
    }

    /**
     * Reads up to four inertia values starting at {@code index}, keeping {@code base} values for
     * the ones not present.
     */
    public Inertia optionalInertia(Inertia base, int index) {
        Inertia.InertiaBuilder b = base.toBuilder();
        int i = index;
        if (has(i)) {
            b.startDelayFactor(floatArg(i++));
        }
        if (has(i)) {
            b.stopDelayFactor(floatArg(i++));
        }
        if (has(i)) {
            b.startFunction(str(i++));
        }
        if (has(i)) {
            b.stopFunction(str(i));
        }
        return b.build();
    }

    /**
     * Lenient number conversion for text already split out of an argument: leading number is
     * used, {@code 0} when there is none. Nothing is reported.
     */
    public static float parseFloat(String text) {
        if (text == null) {
            return 0f;
        }
        Matcher m = FLOAT_PREFIX.matcher(text);
        return m.find() ? Float.parseFloat(m.group().trim()) : 0f;
    }

    /**
     * Lenient integer conversion, see {@link #parseFloat(String)}.
     */
    public static int parseInt(String text) {
        if (text == null) {
            return 0;
        }
        Matcher m = INT_PREFIX.matcher(text);
        if (!m.find()) {
            return 0;
        }
        try {
            return (int) Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static boolean parseBool(String text) {
        String s = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return s.startsWith("true") || s.startsWith("yes") || s.startsWith("1") || s.startsWith("on");
    }
}
