package com.rigdef.parser;

import java.util.List;

/**
 * Arguments produced by a flat split of the line instead of the regular tokenizer.
 */
public class SplitArguments implements Arguments {

    private final List<String> tokens;

    public SplitArguments(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    @Override
    public int count() {
        return tokens.size();
    }

    @Override
    public String get(int index) {
        return tokens.get(index);
    }
}
