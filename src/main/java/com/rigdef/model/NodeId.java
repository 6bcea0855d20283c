package com.rigdef.model;

import lombok.Value;

/**
 * Identity of a declared node: a legacy number (section "nodes") or a name (section "nodes2").
 */
@Value
public class NodeId {
    int number;
    String name;
    boolean named;

    public static NodeId numbered(int number) {
        return new NodeId(number, Integer.toString(number), false);
    }

    public static NodeId named(String name) {
        return new NodeId(0, name, true);
    }

    @Override
    public String toString() {
        return name;
    }
}
