package com.rigdef.parser.extractor;

import java.util.Map;

import com.rigdef.model.element.BaseWheel;
import com.rigdef.model.element.FlexBodyWheel;
import com.rigdef.model.element.MeshWheel;
import com.rigdef.model.element.Wheel;
import com.rigdef.model.element.Wheel2;
import com.rigdef.model.element.WheelDetacher;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.ParserContext;
import com.rigdef.parser.SequentialImporter;

/**
 * Wheel sections. Every wheel generates rim and tyre nodes that legacy documents may
 * reference by number.
 */
public class WheelExtractors implements ExtractorGroup {

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.WHEELS, this::parseWheel);
        handlers.put(Keyword.WHEELS2, this::parseWheel2);
        handlers.put(Keyword.MESHWHEELS, this::parseMeshWheel);
        handlers.put(Keyword.MESHWHEELS2, this::parseMeshWheel);
        handlers.put(Keyword.FLEXBODYWHEELS, this::parseFlexBodyWheel);
        handlers.put(Keyword.WHEELDETACHERS, this::parseWheelDetacher);
    }

    private void parseWheel(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(14)) {
            return;
        }
        Wheel wheel = new Wheel();
        wheel.setRadius(args.floatArg(0));
        wheel.setWidth(args.floatArg(1));
        readCommon(ctx, wheel, 2);
        wheel.setSpringiness(args.floatArg(10));
        wheel.setDamping(args.floatArg(11));
        wheel.setFaceMaterialName(args.str(12));
        wheel.setBandMaterialName(args.str(13));

        generateNodes(ctx, wheel);
        ctx.getCurrentModule().getWheels().add(wheel);
    }

    private void parseWheel2(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(17)) {
            return;
        }
        Wheel2 wheel = new Wheel2();
        wheel.setRimRadius(args.floatArg(0));
        wheel.setTyreRadius(args.floatArg(1));
        wheel.setWidth(args.floatArg(2));
        readCommon(ctx, wheel, 3);
        wheel.setRimSpringiness(args.floatArg(11));
        wheel.setRimDamping(args.floatArg(12));
        wheel.setTyreSpringiness(args.floatArg(13));
        wheel.setTyreDamping(args.floatArg(14));
        wheel.setFaceMaterialName(args.str(15));
        wheel.setBandMaterialName(args.str(16));

        generateNodes(ctx, wheel);
        ctx.getCurrentModule().getWheels2().add(wheel);
    }

    private void parseMeshWheel(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(16)) {
            return;
        }
        MeshWheel wheel = new MeshWheel();
        wheel.setMeshwheel2(ctx.getCurrentBlock() == Keyword.MESHWHEELS2);
        wheel.setTyreRadius(args.floatArg(0));
        wheel.setRimRadius(args.floatArg(1));
        wheel.setWidth(args.floatArg(2));
        readCommon(ctx, wheel, 3);
        wheel.setSpring(args.floatArg(11));
        wheel.setDamping(args.floatArg(12));
        wheel.setSide(args.wheelSide(13));
        wheel.setMeshName(args.str(14));
        wheel.setMaterialName(args.str(15));

        generateNodes(ctx, wheel);
        ctx.getCurrentModule().getMeshWheels().add(wheel);
    }

    private void parseFlexBodyWheel(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(16)) {
            return;
        }
        FlexBodyWheel wheel = new FlexBodyWheel();
        wheel.setTyreRadius(args.floatArg(0));
        wheel.setRimRadius(args.floatArg(1));
        wheel.setWidth(args.floatArg(2));
        readCommon(ctx, wheel, 3);
        wheel.setTyreSpringiness(args.floatArg(11));
        wheel.setTyreDamping(args.floatArg(12));
        wheel.setRimSpringiness(args.floatArg(13));
        wheel.setRimDamping(args.floatArg(14));
        wheel.setSide(args.wheelSide(15));
        if (args.has(16)) {
            wheel.setRimMeshName(args.str(16));
        }
        if (args.has(17)) {
            wheel.setTyreMeshName(args.str(17));
        }

        generateNodes(ctx, wheel);
        ctx.getCurrentModule().getFlexBodyWheels().add(wheel);
    }

    private void parseWheelDetacher(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        WheelDetacher detacher = new WheelDetacher();
        detacher.setWheelId(args.intArg(0));
        detacher.setDetacherGroup(args.intArg(1));
        ctx.getCurrentModule().getWheelDetachers().add(detacher);
    }

    /**
     * Reads the eight fields every wheel shares, starting with the ray count at {@code raysIndex}.
     */
    private static void readCommon(ParserContext ctx, BaseWheel wheel, int raysIndex) {
        ArgumentReader args = ctx.getArgs();
        wheel.setNodeDefaults(ctx.getDefaults().getNodeDefaults());
        wheel.setBeamDefaults(ctx.getDefaults().getBeamDefaults());
        wheel.setNumRays(args.intArg(raysIndex));
        wheel.setNode1(args.nodeRef(raysIndex + 1));
        wheel.setNode2(args.nodeRef(raysIndex + 2));
        wheel.setRigidityNode(args.rigidityNode(raysIndex + 3));
        wheel.setBraking(args.braking(raysIndex + 4));
        wheel.setPropulsion(args.propulsion(raysIndex + 5));
        wheel.setReferenceArmNode(args.nodeRef(raysIndex + 6));
        wheel.setMass(args.floatArg(raysIndex + 7));
    }

    private static void generateNodes(ParserContext ctx, BaseWheel wheel) {
        SequentialImporter importer = ctx.getImporter();
        if (!importer.isEnabled()) {
            return;
        }
        try {
            importer.generateNodes(wheel);
        } catch (ArithmeticException e) {
            ctx.getReporter().warning(String.format(
                    "Wheel has too many rays (%d), falling back to 0", wheel.getNumRays()));
            wheel.setNumRays(0);
            importer.generateNodes(wheel);
        }
    }
}
