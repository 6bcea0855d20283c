package com.rigdef.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.model.Module;
import com.rigdef.model.RigDocument;
import com.rigdef.model.element.CameraRail;
import com.rigdef.model.element.Submesh;

import lombok.Getter;
import lombok.Setter;

/**
 * State of one parse, passed to every keyword handler.
 */
@Getter
public class ParserContext {
    private static final Logger log = LoggerFactory.getLogger(ParserContext.class);

    private final RigDocument document;
    private final ParserConfig config;
    private final DiagnosticsReporter reporter;
    private final DefaultsStack defaults = new DefaultsStack();
    private final SequentialImporter importer;
    private final NodeRefResolver nodeRefs;

    private Module currentModule;

    /** Open section, {@code null} when none. */
    @Setter
    private Keyword currentBlock;

    /** Submesh collecting "texcoords" and "cab" lines, {@code null} when none. */
    @Setter
    private Submesh stagedSubmesh;

    /** Camera rail collecting "camerarail" lines, {@code null} when none. */
    @Setter
    private CameraRail stagedCameraRail;

    /** Detacher group assigned to new elements; 0 is the global group. */
    @Setter
    private int detacherGroup;

    /** Current sanitized line. */
    private String line = "";

    private int lineNumber;

    private ArgumentReader args;

    public ParserContext(RigDocument document, ParserConfig config, DiagnosticsReporter reporter) {
        this.document = document;
        this.config = config;
        this.reporter = reporter;
        this.importer = new SequentialImporter(config.isSequentialImport());
        this.nodeRefs = new NodeRefResolver(importer);
        this.currentModule = document.getRootModule();
    }

    void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
        reporter.setLineNumber(lineNumber);
        nodeRefs.setLineNumber(lineNumber);
    }

    void beginLine(String sanitized, Arguments arguments) {
        this.line = sanitized;
        this.args = new ArgumentReader(arguments, reporter, nodeRefs);
    }

    void setCurrentModule(Module module) {
        this.currentModule = module;
    }

    /**
     * Reader over a custom split of the current line, for keywords whose payload is a flat list.
     */
    public ArgumentReader reader(List<String> tokens) {
        return new ArgumentReader(new SplitArguments(tokens), reporter, nodeRefs);
    }

    /**
     * Commits the staged submesh and camera rail to the current module.
     */
    public void flushStaged() {
        if (stagedSubmesh != null) {
            currentModule.getSubmeshes().add(stagedSubmesh);
            stagedSubmesh = null;
        }
        if (stagedCameraRail != null) {
            if (stagedCameraRail.getNodes().isEmpty()) {
                reporter.warning("Empty section 'camerarail', ignoring...");
            } else {
                currentModule.getCameraRails().add(stagedCameraRail);
                log.debug("Committed camera rail with {} nodes", stagedCameraRail.getNodes().size());
            }
            stagedCameraRail = null;
        }
    }

    /**
     * Flushes staged blocks and closes the open section.
     */
    public void closeBlock() {
        flushStaged();
        currentBlock = null;
    }
}
