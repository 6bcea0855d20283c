package com.rigdef.parser.extractor;

import java.util.Map;

import com.rigdef.model.Vector3;
import com.rigdef.model.element.Airbrake;
import com.rigdef.model.element.Fusedrag;
import com.rigdef.model.element.Pistonprop;
import com.rigdef.model.element.Screwprop;
import com.rigdef.model.element.Turbojet;
import com.rigdef.model.element.Turboprop;
import com.rigdef.model.element.Wing;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.ParserContext;

/**
 * Wings, airbrakes, fuselage drag and aircraft/boat propulsion.
 */
public class AeroExtractors implements ExtractorGroup {

    private static final String FUSEDRAG_AUTOCALC = "autocalc";

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.WINGS, this::parseWing);
        handlers.put(Keyword.AIRBRAKES, this::parseAirbrake);
        handlers.put(Keyword.FUSEDRAG, this::parseFusedrag);
        handlers.put(Keyword.TURBOJETS, this::parseTurbojet);
        handlers.put(Keyword.TURBOPROPS, this::parseTurboprop);
        handlers.put(Keyword.TURBOPROPS2, this::parseTurboprop);
        handlers.put(Keyword.PISTONPROPS, this::parsePistonprop);
        handlers.put(Keyword.SCREWPROPS, this::parseScrewprop);
    }

    private void parseWing(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(16)) {
            return;
        }
        Wing wing = new Wing();
        for (int i = 0; i < 8; i++) {
            wing.getNodes().add(args.nodeRef(i));
        }
        for (int i = 8; i < 16; i++) {
            wing.getTexCoords()[i - 8] = args.floatArg(i);
        }
        if (args.has(16)) {
            wing.setControlSurface(args.wingSurface(16));
        }
        if (args.has(17)) {
            wing.setChordPoint(args.floatArg(17));
        }
        if (args.has(18)) {
            wing.setMinDeflection(args.floatArg(18));
        }
        if (args.has(19)) {
            wing.setMaxDeflection(args.floatArg(19));
        }
        if (args.has(20)) {
            wing.setAirfoil(args.str(20));
        }
        if (args.has(21)) {
            wing.setEfficacyCoef(args.floatArg(21));
        }
        ctx.getCurrentModule().getWings().add(wing);
    }

    private void parseAirbrake(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(14)) {
            return;
        }
        Airbrake airbrake = new Airbrake();
        airbrake.setReferenceNode(args.nodeRef(0));
        airbrake.setXAxisNode(args.nodeRef(1));
        airbrake.setYAxisNode(args.nodeRef(2));
        airbrake.setAdditionalNode(args.nodeRef(3));
        airbrake.setOffset(new Vector3(args.floatArg(4), args.floatArg(5), args.floatArg(6)));
        airbrake.setWidth(args.floatArg(7));
        airbrake.setHeight(args.floatArg(8));
        airbrake.setMaxInclinationAngle(args.floatArg(9));
        airbrake.setTexcoordX1(args.floatArg(10));
        airbrake.setTexcoordY1(args.floatArg(11));
        airbrake.setTexcoordX2(args.floatArg(12));
        airbrake.setTexcoordY2(args.floatArg(13));
        ctx.getCurrentModule().getAirbrakes().add(airbrake);
    }

    private void parseFusedrag(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(3)) {
            return;
        }
        Fusedrag fusedrag = new Fusedrag();
        fusedrag.setFrontNode(args.nodeRef(0));
        fusedrag.setRearNode(args.nodeRef(1));

        if (FUSEDRAG_AUTOCALC.equals(args.str(2))) {
            fusedrag.setAutocalc(true);
            if (args.has(3)) {
                fusedrag.setAreaCoefficient(args.floatArg(3));
            }
            if (args.has(4)) {
                fusedrag.setAirfoilName(args.str(4));
            }
        } else {
            fusedrag.setApproximateWidth(args.floatArg(2));
            if (args.has(3)) {
                fusedrag.setAirfoilName(args.str(3));
            }
        }
        ctx.getCurrentModule().getFusedrag().add(fusedrag);
    }

    private void parseTurbojet(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(9)) {
            return;
        }
        Turbojet turbojet = new Turbojet();
        turbojet.setFrontNode(args.nodeRef(0));
        turbojet.setBackNode(args.nodeRef(1));
        turbojet.setSideNode(args.nodeRef(2));
        turbojet.setReversable(args.intArg(3));
        turbojet.setDryThrust(args.floatArg(4));
        turbojet.setWetThrust(args.floatArg(5));
        turbojet.setFrontDiameter(args.floatArg(6));
        turbojet.setBackDiameter(args.floatArg(7));
        turbojet.setNozzleLength(args.floatArg(8));
        ctx.getCurrentModule().getTurbojets().add(turbojet);
    }

    private void parseTurboprop(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        boolean turboprops2 = ctx.getCurrentBlock() == Keyword.TURBOPROPS2;
        if (!args.checkCount(turboprops2 ? 9 : 8)) {
            return;
        }
        Turboprop turboprop = new Turboprop();
        turboprop.setFormatVersion(turboprops2 ? 2 : 1);
        turboprop.setReferenceNode(args.nodeRef(0));
        turboprop.setAxisNode(args.nodeRef(1));
        turboprop.getBladeTipNodes().add(args.nodeRef(2));
        turboprop.getBladeTipNodes().add(args.nodeRef(3));
        turboprop.getBladeTipNodes().add(args.nullableNode(4));
        turboprop.getBladeTipNodes().add(args.nullableNode(5));

        int offset = 0;
        if (turboprops2) {
            turboprop.setCoupleNode(args.nullableNode(6));
            offset = 1;
        }
        turboprop.setTurbinePowerKw(args.floatArg(6 + offset));
        turboprop.setAirfoil(args.str(7 + offset));
        ctx.getCurrentModule().getTurboprops().add(turboprop);
    }

    private void parsePistonprop(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(10)) {
            return;
        }
        Pistonprop pistonprop = new Pistonprop();
        pistonprop.setReferenceNode(args.nodeRef(0));
        pistonprop.setAxisNode(args.nodeRef(1));
        pistonprop.getBladeTipNodes().add(args.nodeRef(2));
        pistonprop.getBladeTipNodes().add(args.nodeRef(3));
        pistonprop.getBladeTipNodes().add(args.nullableNode(4));
        pistonprop.getBladeTipNodes().add(args.nullableNode(5));
        pistonprop.setCoupleNode(args.nullableNode(6));
        pistonprop.setTurbinePowerKw(args.floatArg(7));
        pistonprop.setPitch(args.floatArg(8));
        pistonprop.setAirfoil(args.str(9));
        ctx.getCurrentModule().getPistonprops().add(pistonprop);
    }

    private void parseScrewprop(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(4)) {
            return;
        }
        Screwprop screwprop = new Screwprop();
        screwprop.setPropNode(args.nodeRef(0));
        screwprop.setBackNode(args.nodeRef(1));
        screwprop.setTopNode(args.nodeRef(2));
        screwprop.setPower(args.floatArg(3));
        ctx.getCurrentModule().getScrewprops().add(screwprop);
    }
}
