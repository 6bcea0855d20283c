package com.rigdef.parser.extractor;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.element.Author;
import com.rigdef.model.element.CollisionRange;
import com.rigdef.model.element.Fileinfo;
import com.rigdef.model.element.Globals;
import com.rigdef.model.element.GuiSettings;
import com.rigdef.model.element.SkeletonSettings;
import com.rigdef.parser.ArgumentReader;
import com.rigdef.parser.ExtractorGroup;
import com.rigdef.parser.Keyword;
import com.rigdef.parser.KeywordHandler;
import com.rigdef.parser.ParserContext;

/**
 * Document metadata (authors, file info, format version) and vehicle-wide settings.
 */
public class MetadataExtractors implements ExtractorGroup {
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractors.class);

    @Override
    public void registerInto(Map<Keyword, KeywordHandler> handlers) {
        handlers.put(Keyword.GLOBALS, this::parseGlobals);
        handlers.put(Keyword.GUISETTINGS, this::parseGuiSettings);
        handlers.put(Keyword.HELP, this::parseHelp);
        handlers.put(Keyword.AUTHOR, this::parseAuthor);
        handlers.put(Keyword.FILEINFO, this::parseFileinfo);
        handlers.put(Keyword.GUID, this::parseGuid);
        handlers.put(Keyword.FILEFORMATVERSION, this::parseFileFormatVersion);
        handlers.put(Keyword.SET_COLLISION_RANGE, this::parseCollisionRange);
        handlers.put(Keyword.SET_SKELETON_SETTINGS, this::parseSkeletonSettings);
        handlers.put(Keyword.DETACHER_GROUP, this::parseDetacherGroup);
    }

    private void parseGlobals(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Globals globals = new Globals();
        globals.setDryMass(args.floatArg(0));
        globals.setCargoMass(args.floatArg(1));
        if (args.has(2)) {
            globals.setMaterialName(args.str(2));
        }
        ctx.getCurrentModule().getGlobals().add(globals);
    }

    private void parseGuiSettings(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        GuiSettings settings = new GuiSettings();
        settings.setKey(args.str(0));
        settings.setValue(args.str(1));
        ctx.getCurrentModule().getGuiSettings().add(settings);
    }

    private void parseHelp(ParserContext ctx) {
        ctx.getCurrentModule().getHelp().add(ctx.getLine());
    }

    private void parseAuthor(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Author author = new Author();
        author.setType(args.str(1));
        if (args.has(2)) {
            author.setForumAccountId(args.intArg(2));
            author.setForumAccountSet(true);
        }
        if (args.has(3)) {
            author.setName(args.str(3));
        }
        if (args.has(4)) {
            author.setEmail(args.str(4));
        }
        ctx.getCurrentModule().getAuthors().add(author);
        ctx.setCurrentBlock(null);
    }

    private void parseFileinfo(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        Fileinfo fileinfo = new Fileinfo();
        fileinfo.setUniqueId(args.str(1).trim());
        if (args.has(2)) {
            fileinfo.setCategoryId(args.intArg(2));
        }
        if (args.has(3)) {
            fileinfo.setFileVersion(args.intArg(3));
        }
        ctx.getCurrentModule().getFileinfo().add(fileinfo);
        ctx.setCurrentBlock(null);
    }

    private void parseGuid(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        ctx.getCurrentModule().getGuid().add(args.str(1));
    }

    /**
     * Versions at or above the configured threshold switch node references to named-only mode.
     */
    private void parseFileFormatVersion(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        int version = args.intArg(1);
        ctx.getCurrentModule().getFileFormatVersions().add(version);
        if (version >= ctx.getConfig().getModernFormatVersion()) {
            ctx.getImporter().markModernFormat();
            log.debug("File format version {} uses named node references only", version);
        }
        ctx.setCurrentBlock(null);
    }

    private void parseCollisionRange(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        CollisionRange range = new CollisionRange();
        range.setNodeCollisionRange(args.floatArg(1));
        ctx.getCurrentModule().getCollisionRanges().add(range);
    }

    /**
     * Updates the module's single skeleton settings entry, creating it on first use.
     */
    private void parseSkeletonSettings(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        List<SkeletonSettings> list = ctx.getCurrentModule().getSkeletonSettings();
        if (list.isEmpty()) {
            list.add(new SkeletonSettings());
        }
        SkeletonSettings settings = list.get(0);
        settings.setVisibilityRangeMeters(args.floatArg(1));
        if (args.has(2)) {
            settings.setBeamThicknessMeters(args.floatArg(2));
        }
        if (settings.getVisibilityRangeMeters() < 0f) {
            settings.setVisibilityRangeMeters(SkeletonSettings.DEFAULT_VISIBILITY_RANGE);
        }
        if (settings.getBeamThicknessMeters() < 0f) {
            settings.setBeamThicknessMeters(BeamDefaults.BEAM_SKELETON_DIAMETER);
        }
    }

    private void parseDetacherGroup(ParserContext ctx) {
        ArgumentReader args = ctx.getArgs();
        if (!args.checkCount(2)) {
            return;
        }
        ctx.setDetacherGroup("end".equals(args.str(1)) ? 0 : args.intArg(1));
    }
}
