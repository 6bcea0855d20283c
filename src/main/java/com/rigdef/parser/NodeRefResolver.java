package com.rigdef.parser;

import com.rigdef.model.NodeRef;

import lombok.Getter;

/**
 * Creates node references from argument text.
 *
 * While the addressing style is unknown, references are valid both as numbers and as names and
 * are handed to the {@link SequentialImporter}. Once the file declared a modern format version,
 * or when import is disabled, references are named only.
 */
public class NodeRefResolver {

    private final SequentialImporter importer;

    @Getter
    private boolean anyNamedNodeDefined;

    private int lineNumber;

    public NodeRefResolver(SequentialImporter importer) {
        this.importer = importer;
    }

    void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    /**
     * Called for every node declared in "nodes2".
     */
    public void markNamedNodeDefined() {
        anyNamedNodeDefined = true;
    }

    public NodeRef resolve(String raw) {
        // flat-split lines keep the blanks after commas
        String text = raw.trim();
        if (importer.isEnabled() && !importer.isModernFormat()) {
            int number = Math.abs(ArgumentReader.parseInt(text));
            NodeRef ref = NodeRef.dual(text, number, lineNumber, anyNamedNodeDefined);
            importer.registerRef(ref);
            return ref;
        }
        return NodeRef.named(text, lineNumber);
    }
}
