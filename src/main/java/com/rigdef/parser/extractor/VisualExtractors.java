package com.rigdef.parser.extractor;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.model.CameraSettings;
import com.rigdef.model.NodeRange;
import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;
import com.rigdef.model.element.AeroEngineSource;
import com.rigdef.model.element.Animation;
import com.rigdef.model.element.AnimationMode;
import com.rigdef.model.element.AnimationSource;
import com.rigdef.model.element.Cab;
import com.rigdef.model.element.CabOption;
import com.rigdef.model.element.Exhaust;
import com.rigdef.model.element.ExtCamera;
import com.rigdef.model.element.ExtCameraMode;
import com.rigdef.model.element.Flare;
import com.rigdef.model.element.FlareType;
import com.rigdef.model.element.Flexbody;
import com.rigdef.model.element.ManagedMaterial;
import com.rigdef.model.element.ManagedMaterialType;
import com.rigdef.model.element.MaterialFlareBinding;
import com.rigdef.model.element.Particle;
import com.rigdef.model.element.Prop;
import com.rigdef.model.element.PropSpecial;
import com.rigdef.model.element.SoundSource;
import com.rigdef.model.element.SoundSource2;
import com.rigdef.model.element.Submesh;
import com.rigdef.model.element.Texcoord;
import com.rigdef.model.element.VideoCamera;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.LineTokenizer;
import com.rigdef.parser.ParserConfig;
import com.rigdef.parser.ParserContext;

/**
 * Meshes, materials, lights, particles, sounds and the directives that decorate the last prop
 * or flexbody.
 */
public class VisualExtractors implements ExtractorGroup {
    private static final Logger log = LoggerFactory.getLogger(VisualExtractors.class);

    /** Length of "add_animation " including its separator. */
    private static final int ADD_ANIMATION_KEYWORD_LENGTH = 14;

    /** Length of "forset". */
    private static final int FORSET_KEYWORD_LENGTH = 6;

    private static final Pattern MOTOR_SOURCE =
            Pattern.compile("^(throttle|rpm|aerotorq|aeropit|aerostatus)(.*)$");

    private static final Pattern UNSIGNED_PREFIX = Pattern.compile("^\\s*\\+?\\d+");

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.PROPS, this::parseProp);
        handlers.put(Keyword.ADD_ANIMATION, this::parseAddAnimation);
        handlers.put(Keyword.PROP_CAMERA_MODE, this::parsePropCameraMode);
        handlers.put(Keyword.FLEXBODIES, this::parseFlexbody);
        handlers.put(Keyword.FORSET, this::parseForset);
        handlers.put(Keyword.FLEXBODY_CAMERA_MODE, this::parseFlexbodyCameraMode);
        handlers.put(Keyword.FLARES, this::parseFlare);
        handlers.put(Keyword.FLARES2, this::parseFlare);
        handlers.put(Keyword.MATERIALFLAREBINDINGS, this::parseMaterialFlareBinding);
        handlers.put(Keyword.MANAGEDMATERIALS, this::parseManagedMaterial);
        handlers.put(Keyword.SUBMESH, this::parseSubmesh);
        handlers.put(Keyword.BACKMESH, this::parseBackmesh);
        handlers.put(Keyword.TEXCOORDS, this::parseTexcoord);
        handlers.put(Keyword.CAB, this::parseCab);
        handlers.put(Keyword.SUBMESH_GROUNDMODEL, this::parseSubmeshGroundModel);
        handlers.put(Keyword.EXHAUSTS, this::parseExhaust);
        handlers.put(Keyword.PARTICLES, this::parseParticle);
        handlers.put(Keyword.VIDEOCAMERA, this::parseVideoCamera);
        handlers.put(Keyword.SOUNDSOURCES, this::parseSoundSource);
        handlers.put(Keyword.SOUNDSOURCES2, this::parseSoundSource2);
        handlers.put(Keyword.EXTCAMERA, this::parseExtCamera);
    }

    private void parseProp(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(10)) {
            return;
        }
        Prop prop = new Prop();
        prop.setReferenceNode(args.nodeRef(0));
        prop.setXAxisNode(args.nodeRef(1));
        prop.setYAxisNode(args.nodeRef(2));
        prop.setOffset(new Vector3(args.floatArg(3), args.floatArg(4), args.floatArg(5)));
        prop.setRotation(new Vector3(args.floatArg(6), args.floatArg(7), args.floatArg(8)));
        prop.setMeshName(args.str(9));
        prop.setSpecial(PropSpecial.fromMeshName(prop.getMeshName()));

        if (prop.getSpecial() == PropSpecial.BEACON && args.count() >= 14) {
            Prop.Beacon beacon = new Prop.Beacon();
            beacon.setFlareMaterialName(args.str(10).trim());
            beacon.setRed(args.floatArg(11));
            beacon.setGreen(args.floatArg(12));
            beacon.setBlue(args.floatArg(13));
            prop.setBeacon(beacon);
        } else if (prop.getSpecial().isDashboard()) {
            Prop.Dashboard dashboard = new Prop.Dashboard();
            if (args.has(10)) {
                dashboard.setMeshName(args.str(10));
            }
            if (args.has(13)) {
                dashboard.setOffset(new Vector3(args.floatArg(11), args.floatArg(12), args.floatArg(13)));
                dashboard.setOffsetSet(true);
            }
            if (args.has(14)) {
                dashboard.setRotationAngle(args.floatArg(14));
            }
            prop.setDashboard(dashboard);
        }
        ctx.getCurrentModule().getProps().add(prop);
    }

    /**
     * {@code add_animation ratio, lower, upper, source: a|b, mode: x-rotation, event: NAME, ...}
     * attaches an animation to the last prop.
     */
    private void parseAddAnimation(ParserContext ctx) {
        List<String> tokens = LineTokenizer.splitFlat(ctx.getLine(), ADD_ANIMATION_KEYWORD_LENGTH, ",");
        if (!ctx.reader(tokens).checkCount(4)) {
            return;
        }
        List<Prop> props = ctx.getCurrentModule().getProps();
        if (props.isEmpty()) {
            ctx.getReporter().error("No prop defined to apply 'add_animation' to, ignoring...");
            return;
        }

        Animation animation = new Animation();
        animation.setRatio(ArgumentReader.parseFloat(tokens.get(0)));
        animation.setLowerLimit(ArgumentReader.parseFloat(tokens.get(1)));
        animation.setUpperLimit(ArgumentReader.parseFloat(tokens.get(2)));

        for (int i = 3; i < tokens.size(); i++) {
            String problem = parseAnimationEntry(animation, tokens.get(i));
            if (problem != null) {
                ctx.getReporter().warning("Ignoring invalid token '" + tokens.get(i) + "' (" + problem + ")");
            }
        }
        props.get(props.size() - 1).getAnimations().add(animation);
    }

    /**
     * @return description of the problem, or {@code null} when the entry was understood
     */
    private static String parseAnimationEntry(Animation animation, String token) {
        List<String> entry = LineTokenizer.splitFlat(token, ":");
        String key = entry.isEmpty() ? "" : entry.get(0).trim();

        if (entry.size() == 1) {
            AnimationMode mode = AnimationMode.fromToken(key);
            if (mode == null || !isStandaloneMode(mode)) {
                return "Invalid keyword: " + key;
            }
            animation.getModes().add(mode);
            return null;
        }
        if (entry.size() != 2 || !(key.equals("mode") || key.equals("event") || key.equals("source"))) {
            return "Invalid item: " + key + ", ignoring...";
        }

        String value = entry.get(1).trim();
        if (key.equals("event")) {
            animation.setEvent(value.toUpperCase(Locale.ROOT));
            return null;
        }

        String problem = null;
        for (String raw : LineTokenizer.splitFlat(value, "|")) {
            String item = raw.trim();
            if (key.equals("mode")) {
                AnimationMode mode = AnimationMode.fromToken(item);
                if (mode != null && !isStandaloneMode(mode)) {
                    animation.getModes().add(mode);
                } else {
                    problem = "Invalid 'mode': " + item + ", ignoring...";
                }
                continue;
            }
            AnimationSource source = AnimationSource.fromToken(item);
            if (source != null) {
                animation.getSources().add(source);
                continue;
            }
            Matcher motor = MOTOR_SOURCE.matcher(item);
            if (motor.matches()) {
                animation.getMotorSources().add(new Animation.MotorSource(
                        AeroEngineSource.fromToken(motor.group(1)), ArgumentReader.parseInt(motor.group(2))));
            } else {
                problem = "Invalid 'source': " + item + ", ignoring...";
            }
        }
        return problem;
    }

    private static boolean isStandaloneMode(AnimationMode mode) {
        return mode == AnimationMode.AUTO_ANIMATE || mode == AnimationMode.NO_FLIP
                || mode == AnimationMode.BOUNCE || mode == AnimationMode.EVENT_LOCK;
    }

    private void parsePropCameraMode(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        List<Prop> props = ctx.getCurrentModule().getProps();
        if (props.isEmpty()) {
            ctx.getReporter().error("No prop defined to apply 'prop_camera_mode' to, ignoring...");
            return;
        }
        parseCameraSettings(ctx, props.get(props.size() - 1).getCameraSettings(), args.str(1));
    }

    private void parseFlexbody(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(10)) {
            return;
        }
        Flexbody flexbody = new Flexbody();
        flexbody.setReferenceNode(args.nodeRef(0));
        flexbody.setXAxisNode(args.nodeRef(1));
        flexbody.setYAxisNode(args.nodeRef(2));
        flexbody.setOffset(new Vector3(args.floatArg(3), args.floatArg(4), args.floatArg(5)));
        flexbody.setRotation(new Vector3(args.floatArg(6), args.floatArg(7), args.floatArg(8)));
        flexbody.setMeshName(args.str(9));
        ctx.getCurrentModule().getFlexbodies().add(flexbody);
    }

    /**
     * {@code forset 1-5, 8, 10-12}: comma separated node numbers and ranges for the last flexbody.
     */
    private void parseForset(ParserContext ctx) {
        List<Flexbody> flexbodies = ctx.getCurrentModule().getFlexbodies();
        if (flexbodies.isEmpty()) {
            ctx.getReporter().error("No flexbody defined to apply 'forset' to, ignoring...");
            return;
        }
        Flexbody flexbody = flexbodies.get(flexbodies.size() - 1);
        int line = ctx.getLineNumber();

        for (String item : LineTokenizer.splitFlat(ctx.getLine(), FORSET_KEYWORD_LENGTH, ",")) {
            int hyphen = item.indexOf('-');
            if (hyphen < 0) {
                String text = item.trim();
                flexbody.getNodeListToImport().add(
                        NodeRange.single(NodeRef.numeric(text, ArgumentReader.parseInt(text), line)));
                continue;
            }
            String startText = hyphen > 0 ? unsignedPrefix(item.substring(0, hyphen)) : "";
            String endText = unsignedPrefix(item.substring(hyphen + 1));
            flexbody.getNodeListToImport().add(new NodeRange(
                    NodeRef.numeric(startText, ArgumentReader.parseInt(startText), line),
                    NodeRef.numeric(endText, ArgumentReader.parseInt(endText), line)));
        }
    }

    private static String unsignedPrefix(String text) {
        Matcher m = UNSIGNED_PREFIX.matcher(text);
        return m.find() ? m.group().trim() : "";
    }

    private void parseFlexbodyCameraMode(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        List<Flexbody> flexbodies = ctx.getCurrentModule().getFlexbodies();
        if (flexbodies.isEmpty()) {
            ctx.getReporter().error("No flexbody defined to apply 'flexbody_camera_mode' to, ignoring...");
            return;
        }
        parseCameraSettings(ctx, flexbodies.get(flexbodies.size() - 1).getCameraSettings(), args.str(1));
    }

    /**
     * Camera mode value: {@code -2} always visible, {@code -1} external cameras only, a
     * non-negative number selects a cinecam.
     */
    private static void parseCameraSettings(ParserContext ctx, CameraSettings settings, String text) {
        int input = ArgumentReader.parseInt(text);
        if (input >= 0) {
            settings.setMode(CameraSettings.Mode.CINECAM);
            settings.setCinecamIndex(input);
        } else if (input == -1) {
            settings.setMode(CameraSettings.Mode.EXTERNAL);
        } else if (input == -2) {
            settings.setMode(CameraSettings.Mode.ALWAYS);
        } else {
            ctx.getReporter().error("invalid value (" + input + "), skipping line");
        }
    }

    private void parseFlare(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        boolean flares2 = ctx.getCurrentBlock() == Keyword.FLARES2;
        if (!args.checkCount(flares2 ? 6 : 5)) {
            return;
        }
        Flare flare = new Flare();
        int pos = 0;
        flare.setReferenceNode(args.nodeRef(pos++));
        flare.setNodeAxisX(args.nodeRef(pos++));
        flare.setNodeAxisY(args.nodeRef(pos++));
        float x = args.floatArg(pos++);
        float y = args.floatArg(pos++);
        float z = flares2 ? args.floatArg(pos++) : flare.getOffset().getZ();
        flare.setOffset(new Vector3(x, y, z));

        if (args.has(pos)) {
            flare.setType(args.flareType(pos++));
        }
        if (args.has(pos)) {
            if (flare.getType() == FlareType.USER) {
                flare.setControlNumber(args.intArg(pos));
            } else if (flare.getType() == FlareType.DASHBOARD) {
                flare.setDashboardLink(args.str(pos));
            }
            pos++;
        }
        if (args.has(pos)) {
            flare.setBlinkDelayMillis(args.intArg(pos++));
        }
        if (args.has(pos)) {
            flare.setSize(args.floatArg(pos++));
        }
        if (args.has(pos)) {
            flare.setMaterialName(args.str(pos));
        }
        ctx.getCurrentModule().getFlares().add(flare);
    }

    private void parseMaterialFlareBinding(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        MaterialFlareBinding binding = new MaterialFlareBinding();
        binding.setFlareNumber(args.intArg(0));
        binding.setMaterialName(args.str(1));
        ctx.getCurrentModule().getMaterialFlareBindings().add(binding);
    }

    private void parseManagedMaterial(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        ManagedMaterial material = new ManagedMaterial();
        material.setOptions(ctx.getDefaults().getManagedMaterialOptions());
        material.setName(args.str(0));

        String typeText = args.str(1);
        ManagedMaterialType type = ManagedMaterialType.fromToken(typeText);
        if (type == null) {
            ctx.getReporter().warning(typeText + " is an unknown effect");
            return;
        }
        if (!args.checkCount(3)) {
            return;
        }
        material.setType(type);
        material.setDiffuseMap(args.str(2));
        if (type == ManagedMaterialType.MESH_STANDARD || type == ManagedMaterialType.MESH_TRANSPARENT) {
            if (args.has(3)) {
                material.setSpecularMap(args.managedTex(3));
            }
        } else {
            if (args.has(3)) {
                material.setDamagedDiffuseMap(args.managedTex(3));
            }
            if (args.has(4)) {
                material.setSpecularMap(args.managedTex(4));
            }
        }

        ParserConfig config = ctx.getConfig();
        String group = config.getResourceGroup();
        if (!config.getResourceLocator().exists(group, material.getDiffuseMap())) {
            ctx.getReporter().warning("Missing texture file: " + material.getDiffuseMap());
            material.setDiffuseMap("");
        }
        if (material.hasDamagedDiffuseMap()
                && !config.getResourceLocator().exists(group, material.getDamagedDiffuseMap())) {
            ctx.getReporter().warning("Missing texture file: " + material.getDamagedDiffuseMap());
            material.setDamagedDiffuseMap("");
        }
        if (material.hasSpecularMap() && !config.getResourceLocator().exists(group, material.getSpecularMap())) {
            ctx.getReporter().warning("Missing texture file: " + material.getSpecularMap());
            material.setSpecularMap("");
        }
        ctx.getCurrentModule().getManagedMaterials().add(material);
    }

    private void parseSubmesh(ParserContext ctx) {
        ctx.closeBlock();
        ctx.setStagedSubmesh(new Submesh());
        log.debug("Staged new submesh at line {}", ctx.getLineNumber());
    }

    private void parseBackmesh(ParserContext ctx) {
        if (ctx.getStagedSubmesh() != null) {
            ctx.getStagedSubmesh().setBackmesh(true);
        } else {
            ctx.getReporter().error("must come after 'submesh'");
        }
    }

    private void parseTexcoord(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        if (ctx.getStagedSubmesh() == null) {
            ctx.getReporter().error("must come after 'submesh', ignoring line");
            return;
        }
        Texcoord texcoord = new Texcoord();
        texcoord.setNode(args.nodeRef(0));
        texcoord.setU(args.floatArg(1));
        texcoord.setV(args.floatArg(2));
        ctx.getStagedSubmesh().getTexcoords().add(texcoord);
    }

    private void parseCab(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        if (ctx.getStagedSubmesh() == null) {
            ctx.getReporter().error("must come after 'submesh', ignoring line");
            return;
        }
        Cab cab = new Cab();
        cab.setNode1(args.nodeRef(0));
        cab.setNode2(args.nodeRef(1));
        cab.setNode3(args.nodeRef(2));
        if (args.has(3)) {
            for (char c : args.str(3).toCharArray()) {
                switch (c) {
                    case 'n' -> {
                        // placeholder
                    }
                    case 'D' -> {
                        cab.getOptions().add(CabOption.CONTACT);
                        cab.getOptions().add(CabOption.BUOYANT);
                    }
                    case 'F' -> {
                        cab.getOptions().add(CabOption.TOUGHER_10X);
                        cab.getOptions().add(CabOption.BUOYANT);
                    }
                    case 'S' -> {
                        cab.getOptions().add(CabOption.INVULNERABLE);
                        cab.getOptions().add(CabOption.BUOYANT);
                    }
                    default -> {
                        CabOption option = CabOption.fromCode(c);
                        if (option != null) {
                            cab.getOptions().add(option);
                        } else {
                            OptionParsing.warnInvalidOption(ctx.getReporter(), c);
                        }
                    }
                }
            }
        }
        ctx.getStagedSubmesh().getCabTriangles().add(cab);
    }

    private void parseSubmeshGroundModel(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        ctx.getCurrentModule().getSubmeshGroundModels().add(args.str(1));
    }

    private void parseExhaust(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Exhaust exhaust = new Exhaust();
        exhaust.setReferenceNode(args.nodeRef(0));
        exhaust.setDirectionNode(args.nodeRef(1));
        // argument 3 is unused
        if (args.has(3)) {
            exhaust.setParticleName(args.str(3));
        }
        ctx.getCurrentModule().getExhausts().add(exhaust);
    }

    private void parseParticle(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        Particle particle = new Particle();
        particle.setEmitterNode(args.nodeRef(0));
        particle.setReferenceNode(args.nodeRef(1));
        particle.setParticleSystemName(args.str(2));
        ctx.getCurrentModule().getParticles().add(particle);
    }

    private void parseVideoCamera(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(19)) {
            return;
        }
        VideoCamera camera = new VideoCamera();
        camera.setReferenceNode(args.nodeRef(0));
        camera.setLeftNode(args.nodeRef(1));
        camera.setBottomNode(args.nodeRef(2));
        camera.setAltReferenceNode(args.nullableNode(3));
        camera.setAltOrientationNode(args.nullableNode(4));
        camera.setOffset(new Vector3(args.floatArg(5), args.floatArg(6), args.floatArg(7)));
        camera.setRotation(new Vector3(args.floatArg(8), args.floatArg(9), args.floatArg(10)));
        camera.setFieldOfView(args.floatArg(11));
        camera.setTextureWidth(args.intArg(12));
        camera.setTextureHeight(args.intArg(13));
        camera.setMinClipDistance(args.floatArg(14));
        camera.setMaxClipDistance(args.floatArg(15));
        camera.setCameraRole(args.intArg(16));
        camera.setCameraMode(args.intArg(17));
        camera.setMaterialName(args.str(18));
        if (args.has(19)) {
            camera.setCameraName(args.str(19));
        }
        ctx.getCurrentModule().getVideoCameras().add(camera);
    }

    private void parseSoundSource(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        SoundSource source = new SoundSource();
        source.setNode(args.nodeRef(0));
        source.setSoundScriptName(args.str(1));
        ctx.getCurrentModule().getSoundSources().add(source);
    }

    private void parseSoundSource2(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        SoundSource2 source = new SoundSource2();
        source.setNode(args.nodeRef(0));
        source.setSoundScriptName(args.str(2));

        int mode = args.intArg(1);
        if (mode >= 0) {
            source.setMode(SoundSource2.Mode.CINECAM);
            source.setCinecamIndex(mode);
        } else if (mode == -1) {
            source.setMode(SoundSource2.Mode.OUTSIDE);
        } else {
            if (mode < -2) {
                ctx.getReporter().error("invalid mode " + mode + ", falling back to default -2");
            }
            source.setMode(SoundSource2.Mode.ALWAYS);
        }
        ctx.getCurrentModule().getSoundSources2().add(source);
    }

    /**
     * Only one external camera exists per module; later lines update it.
     */
    private void parseExtCamera(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        List<ExtCamera> cameras = ctx.getCurrentModule().getExtCameras();
        if (cameras.isEmpty()) {
            cameras.add(new ExtCamera());
        }
        ExtCamera camera = cameras.get(0);

        ExtCameraMode mode = ExtCameraMode.fromToken(args.str(1));
        if (mode == null || (mode == ExtCameraMode.NODE && !args.has(2))) {
            ctx.getReporter().warning("ignoring invalid extcamera mode '" + args.str(1) + "'");
            return;
        }
        camera.setMode(mode);
        if (mode == ExtCameraMode.NODE) {
            camera.setNode(args.nodeRef(2));
        }
    }
}
