package com.rigdef.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Reference to a node from another element.
 *
 * Until the document's addressing style is known a reference may be valid both as a legacy
 * numeric id and as a node name. The sequential import pass settles every ambiguous reference
 * on exactly one interpretation.
 */
@Getter
@ToString
public class NodeRef {

    /** Literal text as written in the file. */
    private final String text;

    /** Numeric value used when the reference is interpreted as a legacy node number. */
    private final int number;

    /** Source line the reference was read from. */
    private final int lineNumber;

    private boolean numericValid;
    private boolean namedValid;
    private boolean mustCheckNamedFirst;

    private NodeRef(String text, int number, int lineNumber,
                    boolean numericValid, boolean namedValid, boolean mustCheckNamedFirst) {
        this.text = text;
        this.number = number;
        this.lineNumber = lineNumber;
        this.numericValid = numericValid;
        this.namedValid = namedValid;
        this.mustCheckNamedFirst = mustCheckNamedFirst;
    }

    /**
     * Ambiguous reference, valid in both interpretations until resolved.
     */
    public static NodeRef dual(String text, int number, int lineNumber, boolean mustCheckNamedFirst) {
        return new NodeRef(text, number, lineNumber, true, true, mustCheckNamedFirst);
    }

    public static NodeRef named(String text, int lineNumber) {
        return new NodeRef(text, 0, lineNumber, false, true, false);
    }

    public static NodeRef numeric(String text, int number, int lineNumber) {
        return new NodeRef(text, number, lineNumber, true, false, false);
    }

    public boolean isAmbiguous() {
        return numericValid && namedValid;
    }

    public boolean isValidAnyState() {
        return numericValid || namedValid;
    }

    public void resolveAsNumeric() {
        numericValid = true;
        namedValid = false;
        mustCheckNamedFirst = false;
    }

    public void resolveAsNamed() {
        numericValid = false;
        namedValid = true;
        mustCheckNamedFirst = false;
    }
}
