package com.rigdef.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.diagnostics.DiagnosticsSink;
import com.rigdef.model.Module;
import com.rigdef.model.RigDocument;
import com.rigdef.model.element.CameraRail;
import com.rigdef.parser.extractor.AeroExtractors;
import com.rigdef.parser.extractor.DefaultsExtractors;
import com.rigdef.parser.extractor.MetadataExtractors;
import com.rigdef.parser.extractor.PowertrainExtractors;
import com.rigdef.parser.extractor.StructureExtractors;
import com.rigdef.parser.extractor.VisualExtractors;
import com.rigdef.parser.extractor.WheelExtractors;

/**
 * Parser for rig definition ("truck") files.
 *
 * Lines are processed one at a time: the first meaningful line is the title, keyword lines open
 * sections, switch modules or run directives, other lines are data for the open section. Malformed
 * lines are reported through the {@link DiagnosticsSink} and skipped; parsing never stops early
 * except when the input cannot be read.
 */
public class RigDefParser {
    private static final Logger log = LoggerFactory.getLogger(RigDefParser.class);

    private final ParserConfig config;
    private final DiagnosticsSink sink;
    private final LineSanitizer sanitizer;
    private final LineTokenizer tokenizer;
    private final KeywordResolver resolver = new KeywordResolver();
    private final Map<Keyword, KeywordHandler> handlers = new EnumMap<>(Keyword.class);

    public RigDefParser(ParserConfig config, DiagnosticsSink sink) {
        this.config = config;
        this.sink = sink;
        this.sanitizer = new LineSanitizer(config.getMaxLineLength());
        this.tokenizer = new LineTokenizer(config.getMaxArguments());
        List<ExtractorGroup> groups = List.of(
                new StructureExtractors(),
                new WheelExtractors(),
                new AeroExtractors(),
                new PowertrainExtractors(),
                new VisualExtractors(),
                new MetadataExtractors(),
                new DefaultsExtractors());
        for (ExtractorGroup group : groups) {
            group.registerInto(handlers);
        }
        log.debug("Registered {} keyword handlers", handlers.size());
    }

    public RigDefParser(DiagnosticsSink sink) {
        this(ParserConfig.DEFAULT, sink);
    }

    /**
     * @throws RigDefParseException when the file cannot be opened
     */
    public RigDocument parse(Path file) {
        InputStream in;
        try {
            in = Files.newInputStream(file);
        } catch (IOException e) {
            throw new RigDefParseException("Cannot open rig definition " + file + ": " + e.getMessage(), e);
        }
        try (InputStream stream = in) {
            return parse(stream, file.getFileName().toString());
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", file, e.getMessage());
            throw new RigDefParseException("Failed to close " + file, e);
        }
    }

    /**
     * Parses UTF-8 text; malformed byte sequences are replaced with '?'. A read failure ends line
     * processing and is reported; the document read so far is still finalized and returned.
     */
    public RigDocument parse(InputStream in, String fileName) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .replaceWith("?");
        ParserContext ctx = newContext(fileName);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, decoder));
        try {
            String raw;
            while ((raw = reader.readLine()) != null) {
                processRawLine(ctx, raw);
            }
        } catch (IOException e) {
            ctx.getReporter().error("Could not read file: " + e.getMessage());
            log.warn("Read failure in {} after line {}: {}", fileName, ctx.getLineNumber(), e.getMessage());
        }
        return finish(ctx);
    }

    public RigDocument parse(List<String> lines, String fileName) {
        ParserContext ctx = newContext(fileName);
        for (String raw : lines) {
            processRawLine(ctx, raw);
        }
        return finish(ctx);
    }

    private ParserContext newContext(String fileName) {
        log.debug("Parsing rig definition {}", fileName);
        DiagnosticsReporter reporter = new DiagnosticsReporter(sink, fileName);
        return new ParserContext(new RigDocument(), config, reporter);
    }

    private RigDocument finish(ParserContext ctx) {
        ctx.getReporter().setKeyword(null);
        ctx.closeBlock();
        ctx.getImporter().finalizeImport(ctx.getReporter());
        RigDocument doc = ctx.getDocument();
        log.debug("Parsed {} lines: {} nodes, {} beams in root module, {} user modules, {} errors, {} warnings",
                ctx.getLineNumber(), doc.getRootModule().getNodes().size(), doc.getRootModule().getBeams().size(),
                doc.getUserModules().size(), ctx.getReporter().getErrorCount(), ctx.getReporter().getWarningCount());
        return doc;
    }

    void processRawLine(ParserContext ctx, String raw) {
        ctx.setLineNumber(ctx.getLineNumber() + 1);
        String prepared = sanitizer.prepare(raw);
        if (prepared == null) {
            return;
        }

        RigDocument doc = ctx.getDocument();
        if (doc.getTitle() == null) {
            doc.setTitle(prepared.trim());
            return;
        }

        String line = sanitizer.clean(prepared);
        if (line.isEmpty()) {
            return;
        }

        Keyword block = ctx.getCurrentBlock();
        if (block == Keyword.COMMENT || block == Keyword.DESCRIPTION) {
            processFreeTextLine(ctx, block, line, prepared.trim());
            return;
        }

        ctx.beginLine(line, tokenizer.tokenize(line));
        Keyword keyword = resolver.resolve(line);
        if (keyword == null) {
            processDataLine(ctx);
            return;
        }
        ctx.getReporter().setKeyword(keyword.getText());

        switch (keyword.getKind()) {
            case GLOBAL_FLAG -> setGlobalFlag(doc, keyword);
            case MODULE_SWITCH -> changeModule(ctx, keyword);
            case BLOCK_END -> ctx.closeBlock();
            case IGNORED -> log.debug("Line {}: ignoring obsolete keyword '{}'", ctx.getLineNumber(), keyword);
            case DIRECTIVE -> dispatch(ctx, keyword);
            case SECTION -> beginSection(ctx, keyword);
            default -> throw new IllegalStateException("Unhandled keyword kind " + keyword.getKind());
        }
    }

    private void processFreeTextLine(ParserContext ctx, Keyword block, String line, String verbatim) {
        Keyword keyword = resolver.resolve(line);
        if (keyword != null && keyword.getKind() == Keyword.Kind.BLOCK_END) {
            ctx.closeBlock();
            return;
        }
        if (block == Keyword.DESCRIPTION) {
            ctx.getCurrentModule().getDescription().add(verbatim);
        }
    }

    private void processDataLine(ParserContext ctx) {
        Keyword block = ctx.getCurrentBlock();
        if (block == null) {
            return;
        }
        ctx.getReporter().setKeyword(block.getText());
        dispatch(ctx, block);
    }

    private void dispatch(ParserContext ctx, Keyword keyword) {
        KeywordHandler handler = handlers.get(keyword);
        if (handler == null) {
            return;
        }
        try {
            handler.handle(ctx);
        } catch (RuntimeException e) {
            ctx.getReporter().error("Failed to process line: " + e.getMessage());
            log.warn("Handler for '{}' failed on line {}", keyword, ctx.getLineNumber(), e);
        }
    }

    private void beginSection(ParserContext ctx, Keyword keyword) {
        if (keyword != Keyword.CAB && keyword != Keyword.TEXCOORDS) {
            ctx.flushStaged();
        }
        if (keyword == Keyword.CAMERARAIL) {
            ctx.setStagedCameraRail(new CameraRail());
        }
        ctx.setCurrentBlock(keyword);
    }

    private void changeModule(ParserContext ctx, Keyword keyword) {
        RigDocument doc = ctx.getDocument();
        Module current = ctx.getCurrentModule();
        String target;
        if (keyword == Keyword.END_SECTION) {
            if (current.isRoot()) {
                ctx.getReporter().error("Misplaced keyword 'end_section' (already in root module), ignoring...");
                return;
            }
            target = Module.ROOT_MODULE_NAME;
        } else {
            // section <version> <name>; the version is unused
            if (!ctx.getArgs().checkCount(3)) {
                return;
            }
            target = ctx.getArgs().str(2);
            if (target.equals(current.getName())) {
                ctx.getReporter().error("Attempt to re-enter current module, ignoring...");
                return;
            }
        }

        ctx.closeBlock();
        Module next = Module.ROOT_MODULE_NAME.equals(target) ? doc.getRootModule() : doc.getOrCreateModule(target);
        ctx.setCurrentModule(next);
        log.debug("Line {}: switched to module '{}'", ctx.getLineNumber(), next.getName());
    }

    private static void setGlobalFlag(RigDocument doc, Keyword keyword) {
        switch (keyword) {
            case DISABLEDEFAULTSOUNDS -> doc.setDisableDefaultSounds(true);
            case ENABLE_ADVANCED_DEFORMATION -> doc.setEnableAdvancedDeformation(true);
            case FORWARDCOMMANDS -> doc.setForwardCommands(true);
            case HIDEINCHOOSER -> doc.setHideInChooser(true);
            case IMPORTCOMMANDS -> doc.setImportCommands(true);
            case LOCKGROUP_DEFAULT_NOLOCK -> doc.setLockgroupDefaultNolock(true);
            case RESCUER -> doc.setRescuer(true);
            case ROLLON -> doc.setRollon(true);
            case SLIDENODE_CONNECT_INSTANTLY -> doc.setSlidenodeConnectInstantly(true);
            default -> throw new IllegalArgumentException("Not a global flag: " + keyword);
        }
    }
}
