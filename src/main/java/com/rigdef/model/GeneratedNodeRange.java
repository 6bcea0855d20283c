package com.rigdef.model;

import lombok.Value;

/**
 * Block of legacy node numbers that an element (wheel, cinecam) creates implicitly.
 */
@Value
public class GeneratedNodeRange {
    int start;
    int count;

    public int end() {
        return start + count - 1;
    }

    public boolean contains(int number) {
        return number >= start && number < start + count;
    }
}
