package com.rigdef.parser.extractor;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.rigdef.model.NodeId;
import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;
import com.rigdef.model.defaults.Inertia;
import com.rigdef.model.element.AeroEngineSource;
import com.rigdef.model.element.Animator;
import com.rigdef.model.element.AnimatorOption;
import com.rigdef.model.element.Beam;
import com.rigdef.model.element.BeamOption;
import com.rigdef.model.element.Camera;
import com.rigdef.model.element.Cinecam;
import com.rigdef.model.element.CollisionBox;
import com.rigdef.model.element.Command;
import com.rigdef.model.element.Hook;
import com.rigdef.model.element.Hydro;
import com.rigdef.model.element.Lockgroup;
import com.rigdef.model.element.Minimass;
import com.rigdef.model.element.Node;
import com.rigdef.model.element.NodeOption;
import com.rigdef.model.element.RailGroup;
import com.rigdef.model.element.Ropable;
import com.rigdef.model.element.Rope;
import com.rigdef.model.element.Rotator;
import com.rigdef.model.element.Shock;
import com.rigdef.model.element.Shock2;
import com.rigdef.model.element.Shock2Option;
import com.rigdef.model.element.Shock3;
import com.rigdef.model.element.Shock3Option;
import com.rigdef.model.element.ShockOption;
import com.rigdef.model.element.SlideNode;
import com.rigdef.model.element.SlideNodeConstraint;
import com.rigdef.model.element.Tie;
import com.rigdef.model.element.Trigger;
import com.rigdef.model.element.TriggerOption;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.LineTokenizer;
import com.rigdef.parser.ParserContext;
import com.rigdef.parser.SequentialImporter;

/**
 * Nodes, beams and everything that connects them: shocks, hydros, commands, rotators,
 * animators, triggers, ties, ropes, slide nodes, hooks and cameras.
 */
public class StructureExtractors implements ExtractorGroup {

    private static final Pattern ANIMATOR_NUMBERED_KEYWORD =
            Pattern.compile("^(throttle|rpm|aerotorq|aeropit|aerostatus)(\\d+)$");

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.NODES, this::parseNode);
        handlers.put(Keyword.NODES2, this::parseNode);
        handlers.put(Keyword.BEAMS, this::parseBeam);
        handlers.put(Keyword.SHOCKS, this::parseShock);
        handlers.put(Keyword.SHOCKS2, this::parseShock2);
        handlers.put(Keyword.SHOCKS3, this::parseShock3);
        handlers.put(Keyword.HYDROS, this::parseHydro);
        handlers.put(Keyword.COMMANDS, this::parseCommand);
        handlers.put(Keyword.COMMANDS2, this::parseCommand);
        handlers.put(Keyword.ROTATORS, this::parseRotator);
        handlers.put(Keyword.ROTATORS2, this::parseRotator);
        handlers.put(Keyword.ANIMATORS, this::parseAnimator);
        handlers.put(Keyword.TRIGGERS, this::parseTrigger);
        handlers.put(Keyword.TIES, this::parseTie);
        handlers.put(Keyword.ROPES, this::parseRope);
        handlers.put(Keyword.ROPABLES, this::parseRopable);
        handlers.put(Keyword.FIXES, this::parseFix);
        handlers.put(Keyword.CONTACTERS, this::parseContacter);
        handlers.put(Keyword.SLIDENODES, this::parseSlideNode);
        handlers.put(Keyword.RAILGROUPS, this::parseRailGroup);
        handlers.put(Keyword.LOCKGROUPS, this::parseLockgroup);
        handlers.put(Keyword.HOOKS, this::parseHook);
        handlers.put(Keyword.COLLISIONBOXES, this::parseCollisionBox);
        handlers.put(Keyword.MINIMASS, this::parseMinimass);
        handlers.put(Keyword.CINECAM, this::parseCinecam);
        handlers.put(Keyword.CAMERAS, this::parseCamera);
        handlers.put(Keyword.CAMERARAIL, this::parseCameraRail);
    }

    private void parseNode(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(4)) {
            return;
        }
        SequentialImporter importer = ctx.getImporter();

        Node node = new Node();
        node.setNodeDefaults(ctx.getDefaults().getNodeDefaults());
        node.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        node.setDefaultMinimass(ctx.getDefaults().getDefaultMinimass());
        node.setDetacherGroup(ctx.getDetacherGroup());

        if (ctx.getCurrentBlock() == Keyword.NODES2) {
            String name = args.str(0);
            node.setId(NodeId.named(name));
            if (importer.isEnabled()) {
                importer.addNamedNode(name);
            }
            ctx.getNodeRefs().markNamedNodeDefined();
        } else {
            int number = args.intArg(0);
            node.setId(NodeId.numbered(number));
            if (importer.isEnabled()) {
                importer.addNumberedNode(number);
            }
        }

        node.setPosition(new Vector3(args.floatArg(1), args.floatArg(2), args.floatArg(3)));
        if (args.has(4)) {
            node.getOptions().addAll(OptionParsing.nodeOptions(args.str(4), ctx.getReporter()));
        }
        if (args.has(5)) {
            if (node.getOptions().contains(NodeOption.LOAD_WEIGHT)) {
                node.setLoadWeightOverride(args.floatArg(5));
                node.setLoadWeightOverrideSet(true);
            } else {
                ctx.getReporter().warning(
                        "Node has load-weight-override value specified, but option 'l' is not present. Ignoring value...");
            }
        }
        ctx.getCurrentModule().getNodes().add(node);
    }

    private void parseBeam(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Beam beam = new Beam();
        beam.setDefaults(ctx.getDefaults().getBeamDefaults());
        beam.setDetacherGroup(ctx.getDetacherGroup());
        beam.setNode1(args.nodeRef(0));
        beam.setNode2(args.nodeRef(1));

        if (args.has(2)) {
            for (char c : args.str(2).toCharArray()) {
                if (c == 'v') {
                    continue;
                }
                BeamOption option = BeamOption.fromCode(c);
                if (option != null) {
                    beam.getOptions().add(option);
                } else {
                    OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                }
            }
        }
        if (args.has(3) && beam.getOptions().contains(BeamOption.SUPPORT)) {
            int breakFactor = args.intArg(3);
            beam.setExtensionBreakLimit(breakFactor > 0 ? breakFactor : 0f);
            beam.setExtensionBreakLimitSet(true);
        }
        ctx.getCurrentModule().getBeams().add(beam);
    }

    private void parseShock(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(7)) {
            return;
        }
        Shock shock = new Shock();
        shock.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        shock.setDetacherGroup(ctx.getDetacherGroup());
        shock.setNode1(args.nodeRef(0));
        shock.setNode2(args.nodeRef(1));
        shock.setSpringRate(args.floatArg(2));
        shock.setDamping(args.floatArg(3));
        shock.setShortBound(args.floatArg(4));
        shock.setLongBound(args.floatArg(5));
        shock.setPrecompression(args.floatArg(6));

        if (args.has(7)) {
            for (char c : args.str(7).toCharArray()) {
                switch (c) {
                    case 'n', 'v' -> {
                        // filler
                    }
                    case 'r', 'R' -> shock.getOptions().add(ShockOption.ACTIVE_RIGHT);
                    case 'l', 'L' -> shock.getOptions().add(ShockOption.ACTIVE_LEFT);
                    default -> {
                        ShockOption option = ShockOption.fromCode(c);
                        if (option != null) {
                            shock.getOptions().add(option);
                        } else {
                            OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                        }
                    }
                }
            }
        }
        ctx.getCurrentModule().getShocks().add(shock);
    }

    private void parseShock2(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(13)) {
            return;
        }
        Shock2 shock = new Shock2();
        shock.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        shock.setDetacherGroup(ctx.getDetacherGroup());
        shock.setNode1(args.nodeRef(0));
        shock.setNode2(args.nodeRef(1));
        shock.setSpringIn(args.floatArg(2));
        shock.setDampIn(args.floatArg(3));
        shock.setProgressFactorSpringIn(args.floatArg(4));
        shock.setProgressFactorDampIn(args.floatArg(5));
        shock.setSpringOut(args.floatArg(6));
        shock.setDampOut(args.floatArg(7));
        shock.setProgressFactorSpringOut(args.floatArg(8));
        shock.setProgressFactorDampOut(args.floatArg(9));
        shock.setShortBound(args.floatArg(10));
        shock.setLongBound(args.floatArg(11));
        shock.setPrecompression(args.floatArg(12));

        if (args.has(13)) {
            for (char c : args.str(13).toCharArray()) {
                if (c == 'n' || c == 'v') {
                    continue;
                }
                Shock2Option option = Shock2Option.fromCode(c);
                if (option != null) {
                    shock.getOptions().add(option);
                } else {
                    OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                }
            }
        }
        ctx.getCurrentModule().getShocks2().add(shock);
    }

    private void parseShock3(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(15)) {
            return;
        }
        Shock3 shock = new Shock3();
        shock.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        shock.setDetacherGroup(ctx.getDetacherGroup());
        shock.setNode1(args.nodeRef(0));
        shock.setNode2(args.nodeRef(1));
        shock.setSpringIn(args.floatArg(2));
        shock.setDampIn(args.floatArg(3));
        shock.setDampInSlow(args.floatArg(4));
        shock.setSplitVelIn(args.floatArg(5));
        shock.setDampInFast(args.floatArg(6));
        shock.setSpringOut(args.floatArg(7));
        shock.setDampOut(args.floatArg(8));
        shock.setDampOutSlow(args.floatArg(9));
        shock.setSplitVelOut(args.floatArg(10));
        shock.setDampOutFast(args.floatArg(11));
        shock.setShortBound(args.floatArg(12));
        shock.setLongBound(args.floatArg(13));
        shock.setPrecompression(args.floatArg(14));

        if (args.has(15)) {
            for (char c : args.str(15).toCharArray()) {
                if (c == 'n' || c == 'v') {
                    continue;
                }
                Shock3Option option = Shock3Option.fromCode(c);
                if (option != null) {
                    shock.getOptions().add(option);
                } else {
                    OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                }
            }
        }
        ctx.getCurrentModule().getShocks3().add(shock);
    }

    private void parseHydro(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        Hydro hydro = new Hydro();
        hydro.setInertiaDefaults(ctx.getDefaults().getInertia());
        hydro.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        hydro.setDetacherGroup(ctx.getDetacherGroup());
        hydro.setNode1(args.nodeRef(0));
        hydro.setNode2(args.nodeRef(1));
        hydro.setLengtheningFactor(args.floatArg(2));
        if (args.has(3)) {
            hydro.setOptions(args.str(3));
        }
        hydro.setInertia(args.optionalInertia(Inertia.BUILTIN, 4));
        ctx.getCurrentModule().getHydros().add(hydro);
    }

    private void parseCommand(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        boolean commands2 = ctx.getCurrentBlock() == Keyword.COMMANDS2;
        int minArgs = commands2 ? 8 : 7;
        if (!args.checkCount(minArgs)) {
            return;
        }
        Command command = new Command();
        command.setFormatVersion(commands2 ? 2 : 1);
        command.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        command.setInertiaDefaults(ctx.getDefaults().getInertia());
        command.setDetacherGroup(ctx.getDetacherGroup());

        int pos = 0;
        command.setNode1(args.nodeRef(pos++));
        command.setNode2(args.nodeRef(pos++));
        command.setShortenRate(args.floatArg(pos++));
        command.setLengthenRate(commands2 ? args.floatArg(pos++) : command.getShortenRate());
        command.setMaxContraction(args.floatArg(pos++));
        command.setMaxExtension(args.floatArg(pos++));
        command.setContractKey(args.intArg(pos++));
        command.setExtendKey(args.intArg(pos++));

        if (!args.has(pos)) {
            ctx.getCurrentModule().getCommands().add(command);
            return;
        }

        parseCommandOptions(ctx, command, args.str(pos++));

        if (args.has(pos)) {
            command.setDescription(args.str(pos++));
        }
        if (args.has(pos)) {
            command.setInertia(args.optionalInertia(Inertia.BUILTIN, pos));
            pos += 4;
        }
        if (args.has(pos)) {
            command.setAffectEngine(args.floatArg(pos++));
        }
        if (args.has(pos)) {
            command.setNeedsEngine(args.boolArg(pos++));
        }
        if (args.has(pos)) {
            command.setPlaysSound(args.boolArg(pos));
        }
        ctx.getCurrentModule().getCommands().add(command);
    }

    /**
     * Command option flags. Of 'o', 'p' and 'c' only the first one given takes effect.
     */
    private void parseCommandOptions(ParserContext ctx, Command command, String options) {
        char winner = 0;
        for (char c : options.toCharArray()) {
            if (winner == 0 && (c == 'o' || c == 'p' || c == 'c')) {
                winner = c;
            }
            switch (c) {
                case 'n' -> {
                    // filler
                }
                case 'i' -> command.setInvisible(true);
                case 'r' -> command.setRope(true);
                case 'f' -> command.setNotFaster(true);
                case 'c' -> command.setAutoCenter(true);
                case 'p' -> command.setOnePress(true);
                case 'o' -> command.setOnePressCenter(true);
                default -> ctx.getReporter().warning("ignoring unknown flag '" + c + "'");
            }
        }

        if (command.isAutoCenter() && winner != 'c' && winner != 0) {
            ctx.getReporter().warning(
                    "Command cannot be one-pressed and self centering at the same time, ignoring flag 'c'");
            command.setAutoCenter(false);
        }
        char ignored = 0;
        if (command.isOnePressCenter() && winner != 'o' && winner != 0) {
            command.setOnePressCenter(false);
            ignored = 'o';
        } else if (command.isOnePress() && winner != 'p' && winner != 0) {
            command.setOnePress(false);
            ignored = 'p';
        }

        if (ignored != 0 && winner == 'c') {
            ctx.getReporter().warning(
                    "Command cannot be one-pressed and self centering at the same time, ignoring flag '" + ignored + "'");
        } else if (ignored != 0) {
            ctx.getReporter().warning("Command already has a one-pressed c.mode, ignoring flag '" + ignored + "'");
        }
    }

    private void parseRotator(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        boolean rotators2 = ctx.getCurrentBlock() == Keyword.ROTATORS2;
        if (!args.checkCount(rotators2 ? 16 : 13)) {
            return;
        }
        Rotator rotator = new Rotator();
        rotator.setFormatVersion(rotators2 ? 2 : 1);
        rotator.setInertiaDefaults(ctx.getDefaults().getInertia());
        rotator.setAxisNode1(args.nodeRef(0));
        rotator.setAxisNode2(args.nodeRef(1));
        for (int i = 2; i < 6; i++) {
            rotator.getBasePlateNodes().add(args.nodeRef(i));
        }
        for (int i = 6; i < 10; i++) {
            rotator.getRotatingPlateNodes().add(args.nodeRef(i));
        }
        rotator.setRate(args.floatArg(10));
        rotator.setSpinLeftKey(args.intArg(11));
        rotator.setSpinRightKey(args.intArg(12));

        int offset = 0;
        if (rotators2) {
            rotator.setRotatingForce(args.floatArg(13));
            rotator.setTolerance(args.floatArg(14));
            rotator.setDescription(args.str(15));
            offset = 3;
        }
        rotator.setInertia(args.optionalInertia(Inertia.BUILTIN, 13 + offset));
        if (args.has(17 + offset)) {
            rotator.setEngineCoupling(args.floatArg(17 + offset));
        }
        if (args.has(18 + offset)) {
            rotator.setNeedsEngine(args.boolArg(18 + offset));
        }
        ctx.getCurrentModule().getRotators().add(rotator);
    }

    private void parseAnimator(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), ",");
        ArgumentReader args = ctx.reader(tokens);
        if (!args.checkCount(4)) {
            return;
        }
        Animator animator = new Animator();
        animator.setInertiaDefaults(ctx.getDefaults().getInertia());
        animator.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        animator.setDetacherGroup(ctx.getDetacherGroup());
        animator.setNode1(args.nodeRef(0));
        animator.setNode2(args.nodeRef(1));
        animator.setLengtheningFactor(ArgumentReader.parseFloat(tokens.get(2)));

        for (String attr : LineTokenizer.splitFlat(tokens.get(3), "|")) {
            String token = attr.trim();
            Matcher numbered = ANIMATOR_NUMBERED_KEYWORD.matcher(token);
            if (numbered.matches()) {
                animator.getAeroFlags().add(AeroEngineSource.fromToken(numbered.group(1)));
                animator.setAeroEngineIndex(ArgumentReader.parseInt(numbered.group(2)) - 1);
            } else if (token.startsWith("shortlimit") || token.startsWith("longlimit")) {
                List<String> fields = LineTokenizer.splitFlat(token, ":");
                if (fields.size() > 1) {
                    float value = ArgumentReader.parseFloat(fields.get(1));
                    if (token.startsWith("shortlimit")) {
                        animator.setShortLimit(value);
                        animator.getFlags().add(AnimatorOption.SHORT_LIMIT);
                    } else {
                        animator.setLongLimit(value);
                        animator.getFlags().add(AnimatorOption.LONG_LIMIT);
                    }
                }
            } else {
                AnimatorOption option = AnimatorOption.fromToken(token);
                if (option != null) {
                    animator.getFlags().add(option);
                } else {
                    ctx.getReporter().warning("ignoring invalid option '" + token + "'");
                }
            }
        }
        ctx.getCurrentModule().getAnimators().add(animator);
    }

    private void parseTrigger(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(6)) {
            return;
        }
        Trigger trigger = new Trigger();
        trigger.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        trigger.setDetacherGroup(ctx.getDetacherGroup());
        trigger.setNode1(args.nodeRef(0));
        trigger.setNode2(args.nodeRef(1));
        trigger.setContractionTriggerLimit(args.floatArg(2));
        trigger.setExpansionTriggerLimit(args.floatArg(3));
        trigger.setShortboundTriggerAction(args.intArg(4));
        trigger.setLongboundTriggerAction(args.intArg(5));

        if (args.has(6)) {
            for (char c : args.str(6).toCharArray()) {
                TriggerOption option = TriggerOption.fromCode(c);
                if (option != null) {
                    trigger.getOptions().add(option);
                } else {
                    OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                }
            }
        }
        if (args.has(7)) {
            float boundaryTimer = args.floatArg(7);
            if (boundaryTimer > 0) {
                trigger.setBoundaryTimer(boundaryTimer);
            }
        }

        if (trigger.isHookToggleTrigger()) {
            trigger.setActionType(Trigger.ActionType.HOOK_TOGGLE);
        } else if (trigger.isEngineTrigger()) {
            trigger.setActionType(Trigger.ActionType.ENGINE);
        } else {
            trigger.setActionType(Trigger.ActionType.COMMAND_KEYS);
        }
        ctx.getCurrentModule().getTriggers().add(trigger);
    }

    private void parseTie(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(5)) {
            return;
        }
        Tie tie = new Tie();
        tie.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        tie.setDetacherGroup(ctx.getDetacherGroup());
        tie.setRootNode(args.nodeRef(0));
        tie.setMaxReachLength(args.floatArg(1));
        tie.setAutoShortenRate(args.floatArg(2));
        tie.setMinLength(args.floatArg(3));
        tie.setMaxLength(args.floatArg(4));

        if (args.has(5)) {
            for (char c : args.str(5).toCharArray()) {
                switch (c) {
                    case 'n', 'v' -> {
                        // filler
                    }
                    case 'i' -> tie.setInvisible(true);
                    case 's' -> tie.setDisableSelfLock(true);
                    default -> OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                }
            }
        }
        if (args.has(6)) {
            tie.setMaxStress(args.floatArg(6));
        }
        if (args.has(7)) {
            tie.setGroup(args.intArg(7));
        }
        ctx.getCurrentModule().getTies().add(tie);
    }

    private void parseRope(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Rope rope = new Rope();
        rope.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        rope.setDetacherGroup(ctx.getDetacherGroup());
        rope.setRootNode(args.nodeRef(0));
        rope.setEndNode(args.nodeRef(1));
        if (args.has(2)) {
            rope.setInvisible(args.ch(2) == 'i');
        }
        ctx.getCurrentModule().getRopes().add(rope);
    }

    private void parseRopable(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(1)) {
            return;
        }
        Ropable ropable = new Ropable();
        ropable.setNode(args.nodeRef(0));
        if (args.has(1)) {
            ropable.setGroup(args.intArg(1));
        }
        if (args.has(2)) {
            ropable.setMultilock(args.intArg(2) == 1);
        }
        ctx.getCurrentModule().getRopables().add(ropable);
    }

    private void parseFix(ParserContext ctx) {
        if (!ctx.getArgs().checkCount(1)) {
            return;
        }
        ctx.getCurrentModule().getFixes().add(ctx.getArgs().nodeRef(0));
    }

    private void parseContacter(ParserContext ctx) {
        if (!ctx.getArgs().checkCount(1)) {
            return;
        }
        ctx.getCurrentModule().getContacters().add(ctx.getArgs().nodeRef(0));
    }

    private void parseSlideNode(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), ", ");
        ArgumentReader args = ctx.reader(tokens);
        if (!args.checkCount(2)) {
            return;
        }
        SlideNode slideNode = new SlideNode();
        slideNode.setSlideNode(args.nodeRef(0));

        boolean inRailNodeList = true;
        for (int i = 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            String value = token.substring(1);
            switch (Character.toUpperCase(token.charAt(0))) {
                case 'S' -> {
                    slideNode.setSpringRate(ArgumentReader.parseFloat(value));
                    inRailNodeList = false;
                }
                case 'B' -> {
                    slideNode.setBreakForce(ArgumentReader.parseFloat(value));
                    inRailNodeList = false;
                }
                case 'T' -> {
                    slideNode.setTolerance(ArgumentReader.parseFloat(value));
                    inRailNodeList = false;
                }
                case 'R' -> {
                    slideNode.setAttachmentRate(ArgumentReader.parseFloat(value));
                    inRailNodeList = false;
                }
                case 'G' -> {
                    slideNode.setRailgroupId((int) ArgumentReader.parseFloat(value));
                    inRailNodeList = false;
                }
                case 'D' -> {
                    slideNode.setMaxAttachDistance(ArgumentReader.parseFloat(value));
                    inRailNodeList = false;
                }
                case 'C' -> {
                    SlideNodeConstraint constraint = value.isEmpty() ? null : SlideNodeConstraint.fromCode(value.charAt(0));
                    if (constraint != null) {
                        slideNode.getConstraints().add(constraint);
                    } else {
                        ctx.getReporter().warning("Ignoring invalid option '" + value + "'");
                    }
                    inRailNodeList = false;
                }
                default -> {
                    if (inRailNodeList) {
                        slideNode.getRailNodes().add(args.nodeRef(i));
                    }
                }
            }
        }
        ctx.getCurrentModule().getSlideNodes().add(slideNode);
    }

    private void parseRailGroup(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), ",");
        ArgumentReader args = ctx.reader(tokens);
        if (!args.checkCount(3)) {
            return;
        }
        RailGroup railGroup = new RailGroup();
        railGroup.setId(ArgumentReader.parseInt(tokens.get(0)));
        for (int i = 1; i < tokens.size(); i++) {
            railGroup.getNodes().add(ctx.getNodeRefs().resolve(tokens.get(i).trim()));
        }
        ctx.getCurrentModule().getRailGroups().add(railGroup);
    }

    private void parseLockgroup(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Lockgroup lockgroup = new Lockgroup();
        lockgroup.setNumber(args.intArg(0));
        for (int i = 1; i < args.count(); i++) {
            lockgroup.getNodes().add(args.nodeRef(i));
        }
        ctx.getCurrentModule().getLockgroups().add(lockgroup);
    }

    private void parseHook(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(1)) {
            return;
        }
        Hook hook = new Hook();
        hook.setNode(args.nodeRef(0));

        int i = 1;
        while (i < args.count()) {
            String attr = args.str(i).trim();
            boolean hasValue = i < args.count() - 1;
            if (hasValue && attr.equals("hookrange")) {
                hook.setHookRange(args.floatArg(++i));
            } else if (hasValue && attr.equals("speedcoef")) {
                hook.setSpeedCoef(args.floatArg(++i));
            } else if (hasValue && attr.equals("maxforce")) {
                hook.setMaxForce(args.floatArg(++i));
            } else if (hasValue && attr.equals("timer")) {
                hook.setTimer(args.floatArg(++i));
            } else if (hasValue && (attr.equals("hookgroup") || attr.equals("hgroup"))) {
                hook.setHookgroup(args.intArg(++i));
            } else if (hasValue && (attr.equals("lockgroup") || attr.equals("lgroup"))) {
                hook.setLockgroup(args.intArg(++i));
            } else if (hasValue && (attr.equals("shortlimit") || attr.equals("short_limit"))) {
                hook.setMinRangeMeters(args.floatArg(++i));
            } else if (isHookFlag(attr, "self", "lock")) {
                hook.setSelfLock(true);
            } else if (isHookFlag(attr, "auto", "lock")) {
                hook.setAutoLock(true);
            } else if (isHookFlag(attr, "no", "disable")) {
                hook.setNoDisable(true);
            } else if (isHookFlag(attr, "no", "rope")) {
                hook.setNoRope(true);
            } else if (attr.equals("visible") || attr.equals("vis")) {
                hook.setVisible(true);
            } else {
                ctx.getReporter().warning("ignoring invalid option '" + attr + "'");
            }
            i++;
        }
        ctx.getCurrentModule().getHooks().add(hook);
    }

    /**
     * Matches "selflock", "self-lock" and "self_lock" style spellings.
     */
    private static boolean isHookFlag(String attr, String prefix, String suffix) {
        return attr.equals(prefix + suffix)
                || attr.equals(prefix + "-" + suffix)
                || attr.equals(prefix + "_" + suffix);
    }

    private void parseCollisionBox(ParserContext ctx) {
        CollisionBox box = new CollisionBox();
        for (String token : LineTokenizer.splitFlat(ctx.getLine(), ",")) {
            box.getNodes().add(ctx.getNodeRefs().resolve(token.trim()));
        }
        ctx.getCurrentModule().getCollisionBoxes().add(box);
    }

    private void parseMinimass(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(1)) {
            return;
        }
        Minimass minimass = new Minimass();
        minimass.setGlobalMinMassKg(args.floatArg(0));
        if (args.has(1)) {
            minimass.setOption(args.minimassOption(1));
        }
        ctx.getCurrentModule().getMinimass().add(minimass);
        ctx.setCurrentBlock(null);
    }

    private void parseCinecam(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(11)) {
            return;
        }
        Cinecam cinecam = new Cinecam();
        cinecam.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        cinecam.setNodeDefaults(ctx.getDefaults().getNodeDefaults());
        cinecam.setPosition(new Vector3(args.floatArg(0), args.floatArg(1), args.floatArg(2)));
        for (int i = 3; i < 11; i++) {
            cinecam.getNodes().add(args.nodeRef(i));
        }
        if (args.has(11)) {
            cinecam.setSpring(args.floatArg(11));
        }
        if (args.has(12)) {
            cinecam.setDamping(args.floatArg(12));
        }
        if (args.has(13)) {
            float mass = args.floatArg(13);
            if (mass > 0) {
                cinecam.setNodeMass(mass);
            }
        }
        if (ctx.getImporter().isEnabled()) {
            ctx.getImporter().generateNodes(cinecam);
        }
        ctx.getCurrentModule().getCinecams().add(cinecam);
    }

    private void parseCamera(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        Camera camera = new Camera();
        camera.setCenterNode(args.nodeRef(0));
        camera.setBackNode(args.nodeRef(1));
        camera.setLeftNode(args.nodeRef(2));
        ctx.getCurrentModule().getCameras().add(camera);
    }

    private void parseCameraRail(ParserContext ctx) {
        if (!ctx.getArgs().checkCount(1) || ctx.getStagedCameraRail() == null) {
            return;
        }
        NodeRef node = ctx.getArgs().nodeRef(0);
        ctx.getStagedCameraRail().getNodes().add(node);
    }
}
