package com.rigdef.parser.extractor;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.DefaultMinimass;
import com.rigdef.model.defaults.ManagedMaterialOptions;
import com.rigdef.model.element.NodeOption;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.DefaultsStack;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.ParserContext;

/**
 * "set_*_defaults" style directives. Each publishes a new snapshot on the {@link DefaultsStack};
 * elements defined earlier keep the snapshot they captured.
 */
public class DefaultsExtractors implements ExtractorGroup {
    private static final Logger log = LoggerFactory.getLogger(DefaultsExtractors.class);

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.SET_NODE_DEFAULTS, this::parseNodeDefaults);
        handlers.put(Keyword.SET_BEAM_DEFAULTS, this::parseBeamDefaults);
        handlers.put(Keyword.SET_BEAM_DEFAULTS_SCALE, this::parseBeamDefaultsScale);
        handlers.put(Keyword.SET_INERTIA_DEFAULTS, this::parseInertiaDefaults);
        handlers.put(Keyword.SET_MANAGEDMATERIALS_OPTIONS, this::parseManagedMaterialsOptions);
        handlers.put(Keyword.SET_DEFAULT_MINIMASS, this::parseDefaultMinimass);
    }

    private void parseNodeDefaults(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        float loadWeight = args.floatArg(1);
        float friction = args.has(2) ? args.floatArg(2) : -1f;
        float volume = args.has(3) ? args.floatArg(3) : -1f;
        float surface = args.has(4) ? args.floatArg(4) : -1f;
        Set<NodeOption> options = OptionParsing.nodeOptions(args.has(5) ? args.str(5) : "", ctx.getReporter());

        ctx.getDefaults().setNodeDefaults(loadWeight, friction, volume, surface, options);
    }

    private void parseBeamDefaults(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        BeamDefaults defaults = ctx.getDefaults().setBeamDefaults(
                args.floatArg(1),
                args.has(2) ? args.floatArg(2) : null,
                args.has(3) ? args.floatArg(3) : null,
                args.has(4) ? args.floatArg(4) : null,
                args.has(5) ? args.floatArg(5) : null,
                args.has(6) ? args.str(6) : null,
                args.has(7) ? args.floatArg(7) : null,
                ctx.getDocument().isEnableAdvancedDeformation());
        log.debug("Published beam defaults at line {}: {}", ctx.getLineNumber(), defaults);
    }

    private void parseBeamDefaultsScale(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(5)) {
            return;
        }
        ctx.getDefaults().setBeamDefaultsScale(
                args.floatArg(1), args.floatArg(2), args.floatArg(3), args.floatArg(4));
    }

    private void parseInertiaDefaults(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        float startDelay = args.floatArg(1);
        float stopDelay = args.has(2) ? args.floatArg(2) : 0f;
        ctx.getDefaults().setInertiaDefaults(startDelay, stopDelay,
                args.has(3) ? args.str(3) : null,
                args.has(4) ? args.str(4) : null);
    }

    private void parseManagedMaterialsOptions(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        ctx.getDefaults().setManagedMaterialOptions(new ManagedMaterialOptions(args.ch(1) != '0'));
    }

    private void parseDefaultMinimass(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        ctx.getDefaults().setDefaultMinimass(new DefaultMinimass(args.floatArg(1)));
    }
}
