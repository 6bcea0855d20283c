package com.rigdef.model;

import lombok.Value;

/**
 * Inclusive range of legacy node numbers, used by "forset".
 */
@Value
public class NodeRange {
    NodeRef start;
    NodeRef end;

    public static NodeRange single(NodeRef node) {
        return new NodeRange(node, node);
    }

    public boolean isSingle() {
        return start == end;
    }
}
