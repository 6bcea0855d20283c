package com.rigdef.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.diagnostics.Severity;
import com.rigdef.model.GeneratedNodeRange;
import com.rigdef.model.GeneratesNodes;
import com.rigdef.model.NodeRef;

import lombok.Getter;

/**
 * Settles node references once the whole file has been read.
 *
 * Legacy files address nodes by number, including the nodes that wheels and cinecams create
 * implicitly; newer files use names. Both styles are tracked while reading, and
 * {@link #finalizeImport(DiagnosticsReporter)} picks one interpretation per reference.
 */
public class SequentialImporter {
    private static final Logger log = LoggerFactory.getLogger(SequentialImporter.class);

    private static final Pattern NUMERIC = Pattern.compile("^[+-]?\\d+$");

    @Getter
    private final boolean enabled;

    private final List<NodeRef> refs = new ArrayList<>();
    private final Set<Integer> numberedNodes = new HashSet<>();
    private final Set<String> namedNodes = new HashSet<>();
    private final List<PendingBlock> generatedBlocks = new ArrayList<>();

    @Getter
    private int nodeCount;

    private int maxNumbered = -1;

    @Getter
    private boolean modernFormat;

    @Getter
    private boolean finalized;

    public SequentialImporter(boolean enabled) {
        this.enabled = enabled;
    }

    public void addNumberedNode(int number) {
        numberedNodes.add(number);
        maxNumbered = Math.max(maxNumbered, number);
        nodeCount++;
    }

    public void addNamedNode(String name) {
        namedNodes.add(name);
        nodeCount++;
    }

    public void registerRef(NodeRef ref) {
        refs.add(ref);
    }

    /**
     * Reserves legacy numbers for the nodes an element generates. Numbering continues after the
     * nodes declared so far.
     *
     * @throws ArithmeticException if the block would run past the largest node number; nothing
     *         is reserved in that case
     */
    public GeneratedNodeRange generateNodes(GeneratesNodes owner) {
        int count = owner.generatedNodeCount();
        int start = Math.max(nodeCount, maxNumbered + 1);
        int end = Math.addExact(start, count);
        GeneratedNodeRange range = new GeneratedNodeRange(start, count);
        generatedBlocks.add(new PendingBlock(owner, range));
        nodeCount = end;
        return range;
    }

    /**
     * Marks the file as using named nodes only, from "fileformatversion".
     */
    public void markModernFormat() {
        modernFormat = true;
    }

    public boolean isNamedOnly() {
        return modernFormat || (!namedNodes.isEmpty() && numberedNodes.isEmpty());
    }

    public int getRefCount() {
        return refs.size();
    }

    /**
     * Resolves every buffered reference. Runs once; later calls do nothing.
     */
    public void finalizeImport(DiagnosticsReporter reporter) {
        if (!enabled || finalized) {
            return;
        }
        finalized = true;

        if (isNamedOnly()) {
            for (NodeRef ref : refs) {
                ref.resolveAsNamed();
            }
            log.debug("Sequential import: named-only document, {} references resolved as named", refs.size());
            return;
        }

        int unresolved = 0;
        for (NodeRef ref : refs) {
            String text = ref.getText();
            boolean nameDeclared = namedNodes.contains(text);
            if (ref.isMustCheckNamedFirst() && nameDeclared) {
                ref.resolveAsNamed();
            } else if (NUMERIC.matcher(text).matches()) {
                ref.resolveAsNumeric();
            } else if (nameDeclared) {
                ref.resolveAsNamed();
            } else {
                unresolved++;
                reporter.reportAt(Severity.WARNING, ref.getLineNumber(), null,
                        "Node '" + text + "' is neither a node number nor a declared node name, keeping it as named reference");
                ref.resolveAsNamed();
            }
        }
        for (PendingBlock block : generatedBlocks) {
            block.owner.setGeneratedNodes(block.range);
        }
        log.debug("Sequential import: legacy document, {} references, {} generated node blocks, {} unresolved",
                refs.size(), generatedBlocks.size(), unresolved);
    }

    private static class PendingBlock {
        private final GeneratesNodes owner;
        private final GeneratedNodeRange range;

        PendingBlock(GeneratesNodes owner, GeneratedNodeRange range) {
            this.owner = owner;
            this.range = range;
        }
    }
}
