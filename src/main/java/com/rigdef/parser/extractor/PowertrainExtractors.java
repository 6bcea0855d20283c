package com.rigdef.parser.extractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.model.NodeRef;
import com.rigdef.model.element.AntiLockBrakes;
import com.rigdef.model.element.Axle;
import com.rigdef.model.element.Brakes;
import com.rigdef.model.element.CruiseControl;
import com.rigdef.model.element.DifferentialType;
import com.rigdef.model.element.Engine;
import com.rigdef.model.element.EngineType;
import com.rigdef.model.element.Engoption;
import com.rigdef.model.element.Engturbo;
import com.rigdef.model.element.InterAxle;
import com.rigdef.model.element.SpeedLimiter;
import com.rigdef.model.element.TorqueCurve;
import com.rigdef.model.element.TractionControl;
import com.rigdef.model.element.TransferCase;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.LineTokenizer;
import com.rigdef.parser.ParserContext;

/**
 * Engine, transmission, differentials and driver aids.
 */
public class PowertrainExtractors implements ExtractorGroup {

    /** One property of an "axles" line: {@code w1(node node)} or {@code d(types)}. */
    private static final Pattern AXLE_PROPERTY =
            Pattern.compile("(w([12])\\(\\s*([^\\s)]+)\\s+([^\\s)]+)\\s*\\))|(d\\(([^)]*)\\))");

    /** Length of "TractionControl" and of "AntiLockBrakes " including its separator. */
    private static final int DRIVER_AID_KEYWORD_LENGTH = 15;

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.ENGINE, this::parseEngine);
        handlers.put(Keyword.ENGOPTION, this::parseEngoption);
        handlers.put(Keyword.ENGTURBO, this::parseEngturbo);
        handlers.put(Keyword.TORQUECURVE, this::parseTorqueCurve);
        handlers.put(Keyword.BRAKES, this::parseBrakes);
        handlers.put(Keyword.AXLES, this::parseAxle);
        handlers.put(Keyword.INTERAXLES, this::parseInterAxle);
        handlers.put(Keyword.TRANSFERCASE, this::parseTransferCase);
        handlers.put(Keyword.TRACTIONCONTROL, this::parseTractionControl);
        handlers.put(Keyword.ANTILOCKBRAKES, this::parseAntiLockBrakes);
        handlers.put(Keyword.CRUISECONTROL, this::parseCruiseControl);
        handlers.put(Keyword.SPEEDLIMITER, this::parseSpeedLimiter);
    }

    private void parseEngine(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(6)) {
            return;
        }
        Engine engine = new Engine();
        engine.setShiftDownRpm(args.floatArg(0));
        engine.setShiftUpRpm(args.floatArg(1));
        engine.setTorque(args.floatArg(2));
        engine.setGlobalGearRatio(args.floatArg(3));
        engine.setReverseGearRatio(args.floatArg(4));
        engine.setNeutralGearRatio(args.floatArg(5));

        for (int i = 6; i < args.count(); i++) {
            float ratio = args.floatArg(i);
            if (ratio < 0f) {
                // optional terminator
                break;
            }
            engine.getGearRatios().add(ratio);
        }
        if (engine.getGearRatios().isEmpty()) {
            ctx.getReporter().error("no forward gear");
            return;
        }
        ctx.getCurrentModule().getEngines().add(engine);
    }

    private void parseEngoption(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(1)) {
            return;
        }
        Engoption engoption = new Engoption();
        engoption.setInertia(args.floatArg(0));
        if (args.has(1)) {
            EngineType type = EngineType.fromCode(args.ch(1));
            if (type != null) {
                engoption.setType(type);
            } else {
                ctx.getReporter().warning("Invalid engine type '" + args.str(1) + "', using 't' (truck)");
            }
        }
        if (args.has(2)) {
            engoption.setClutchForce(args.floatArg(2));
        }
        if (args.has(3)) {
            engoption.setShiftTime(args.floatArg(3));
        }
        if (args.has(4)) {
            engoption.setClutchTime(args.floatArg(4));
        }
        if (args.has(5)) {
            engoption.setPostShiftTime(args.floatArg(5));
        }
        if (args.has(6)) {
            engoption.setStallRpm(args.floatArg(6));
        }
        if (args.has(7)) {
            engoption.setIdleRpm(args.floatArg(7));
        }
        if (args.has(8)) {
            engoption.setMaxIdleMixture(args.floatArg(8));
        }
        if (args.has(9)) {
            engoption.setMinIdleMixture(args.floatArg(9));
        }
        if (args.has(10)) {
            engoption.setBrakingTorque(args.floatArg(10));
        }
        ctx.getCurrentModule().getEngoptions().add(engoption);
    }

    private void parseEngturbo(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(4)) {
            return;
        }
        Engturbo engturbo = new Engturbo();
        engturbo.setVersion(args.intArg(0));
        engturbo.setTinertiaFactor(args.floatArg(1));
        engturbo.setNturbos(args.intArg(2));
        for (int i = 3; i < Math.min(args.count(), 14); i++) {
            engturbo.getParameters().add(args.floatArg(i));
        }
        if (engturbo.getNturbos() > Engturbo.MAX_TURBOS) {
            ctx.getReporter().warning("You cannot have more than 4 turbos. Fallback: using 4 instead.");
            engturbo.setNturbos(Engturbo.MAX_TURBOS);
        }
        ctx.getCurrentModule().getEngturbos().add(engturbo);
    }

    /**
     * All "torquecurve" lines of a module feed one curve: either a predefined function name or
     * power/torque samples.
     */
    private void parseTorqueCurve(ParserContext ctx) {
        List<TorqueCurve> curves = ctx.getCurrentModule().getTorqueCurves();
        if (curves.isEmpty()) {
            curves.add(new TorqueCurve());
        }
        TorqueCurve curve = curves.get(0);

        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), ",");
        if (tokens.size() == 1) {
            curve.setPredefinedFuncName(tokens.get(0));
        } else if (tokens.size() == 2) {
            curve.getSamples().add(new TorqueCurve.Sample(
                    ArgumentReader.parseFloat(tokens.get(0)), ArgumentReader.parseFloat(tokens.get(1))));
        } else {
            ctx.getReporter().error("too many arguments, skipping");
        }
    }

    private void parseBrakes(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(1)) {
            return;
        }
        Brakes brakes = new Brakes();
        brakes.setDefaultBrakingForce(args.floatArg(0));
        if (args.has(1)) {
            brakes.setParkingBrakeForce(args.floatArg(1));
        }
        ctx.getCurrentModule().getBrakes().add(brakes);
    }

    private void parseAxle(ParserContext ctx) {
        Axle axle = new Axle();
        for (String token : LineTokenizer.splitFlat(ctx.getLine(), ",")) {
            Matcher m = AXLE_PROPERTY.matcher(token);
            if (!m.find()) {
                ctx.getReporter().error("Invalid property, ignoring whole line...");
                return;
            }
            if (m.group(1) != null) {
                NodeRef[] wheel = {
                        ctx.getNodeRefs().resolve(m.group(3)), ctx.getNodeRefs().resolve(m.group(4))};
                if ("1".equals(m.group(2))) {
                    axle.setWheel1(wheel);
                } else {
                    axle.setWheel2(wheel);
                }
            } else {
                axle.getOptions().addAll(differentialTypes(m.group(6), ctx.getReporter()));
            }
        }
        ctx.getCurrentModule().getAxles().add(axle);
    }

    private void parseInterAxle(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), ",");
        if (!ctx.reader(tokens).checkCount(3)) {
            return;
        }
        InterAxle interAxle = new InterAxle();
        interAxle.setA1(ArgumentReader.parseInt(tokens.get(0)) - 1);
        interAxle.setA2(ArgumentReader.parseInt(tokens.get(1)) - 1);

        Matcher m = AXLE_PROPERTY.matcher(tokens.get(2));
        if (!m.find()) {
            ctx.getReporter().error("Invalid property, ignoring whole line...");
            return;
        }
        if (m.group(5) != null) {
            interAxle.getOptions().addAll(differentialTypes(m.group(6), ctx.getReporter()));
        }
        ctx.getCurrentModule().getInterAxles().add(interAxle);
    }

    private void parseTransferCase(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        TransferCase transferCase = new TransferCase();
        transferCase.setA1(args.intArg(0) - 1);
        transferCase.setA2(args.intArg(1) - 1);
        if (args.has(2)) {
            transferCase.setHas2wd(args.intArg(2) != 0);
        }
        if (args.has(3)) {
            transferCase.setHas2wdLo(args.intArg(3) != 0);
        }
        for (int i = 4; i < args.count(); i++) {
            transferCase.getGearRatios().add(args.floatArg(i));
        }
        ctx.getCurrentModule().getTransferCases().add(transferCase);
    }

    private void parseTractionControl(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), DRIVER_AID_KEYWORD_LENGTH, ",");
        if (!ctx.reader(tokens).checkCount(2)) {
            return;
        }
        TractionControl tc = new TractionControl();
        tc.setRegulationForce(ArgumentReader.parseFloat(tokens.get(0)));
        tc.setWheelSlip(ArgumentReader.parseFloat(tokens.get(1)));
        if (tokens.size() > 2) {
            tc.setFadeSpeed(ArgumentReader.parseFloat(tokens.get(2)));
        }
        if (tokens.size() > 3) {
            tc.setPulsePerSec(ArgumentReader.parseFloat(tokens.get(3)));
        }

        DriverAidMode mode = new DriverAidMode();
        for (int i = 4; i < tokens.size(); i++) {
            mode.apply(tokens.get(i), ctx.getReporter());
        }
        tc.setNoDashboard(mode.noDashboard);
        tc.setNoToggle(mode.noToggle);
        tc.setOn(mode.on);
        ctx.getCurrentModule().getTractionControls().add(tc);
    }

    private void parseAntiLockBrakes(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), DRIVER_AID_KEYWORD_LENGTH, ",");
        if (!ctx.reader(tokens).checkCount(2)) {
            return;
        }
        AntiLockBrakes alb = new AntiLockBrakes();
        alb.setRegulationForce(ArgumentReader.parseFloat(tokens.get(0)));
        alb.setMinSpeed(ArgumentReader.parseInt(tokens.get(1)));
        if (tokens.size() > 2) {
            alb.setPulsePerSec(ArgumentReader.parseFloat(tokens.get(2)));
        }

        DriverAidMode mode = new DriverAidMode();
        for (int i = 3; i < tokens.size(); i++) {
            mode.apply(tokens.get(i), ctx.getReporter());
        }
        alb.setNoDashboard(mode.noDashboard);
        alb.setNoToggle(mode.noToggle);
        alb.setOn(mode.on);
        ctx.getCurrentModule().getAntiLockBrakes().add(alb);
    }

    private void parseCruiseControl(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        CruiseControl cruiseControl = new CruiseControl();
        cruiseControl.setMinSpeed(args.floatArg(1));
        cruiseControl.setAutobrake(args.intArg(2));
        ctx.getCurrentModule().getCruiseControls().add(cruiseControl);
    }

    private void parseSpeedLimiter(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        SpeedLimiter limiter = new SpeedLimiter();
        limiter.setEnabled(true);
        limiter.setMaxSpeed(args.floatArg(1));
        ctx.getCurrentModule().getSpeedLimiters().add(limiter);
    }

    private static List<DifferentialType> differentialTypes(String text, DiagnosticsReporter reporter) {
        List<DifferentialType> types = new ArrayList<>();
        for (char c : text.toCharArray()) {
            DifferentialType type = DifferentialType.fromCode(c);
            if (type != null) {
                types.add(type);
            } else {
                reporter.warning("ignoring invalid differential type '" + c + "'");
            }
        }
        return types;
    }

    /**
     * "mode:" attribute of TractionControl and AntiLockBrakes, e.g. {@code mode: nodash & notoggle & on}.
     */
    private static final class DriverAidMode {
        private boolean noDashboard;
        private boolean noToggle;
        private boolean on = true;

        void apply(String token, DiagnosticsReporter reporter) {
            List<String> parts = LineTokenizer.splitFlat(token, ":");
            String name = parts.isEmpty() ? "" : parts.get(0).trim().toLowerCase(Locale.ROOT);
            if (!"mode".equals(name) || parts.size() != 2) {
                reporter.error("missing mode");
                noDashboard = false;
                noToggle = false;
                on = true;
                return;
            }
            for (String raw : LineTokenizer.splitFlat(parts.get(1), "&")) {
                String attr = raw.trim().toLowerCase(Locale.ROOT);
                if (attr.startsWith("nodash")) {
                    noDashboard = true;
                } else if (attr.startsWith("notoggle")) {
                    noToggle = true;
                } else if (attr.startsWith("on")) {
                    on = true;
                } else if (attr.startsWith("off")) {
                    on = false;
                }
            }
        }
    }
}
