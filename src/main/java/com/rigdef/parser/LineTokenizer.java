package com.rigdef.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits sanitized lines into arguments.
 *
 * Separators are space, tab, ':', '|' and ','. Runs of separators count as one. Arguments beyond
 * the configured maximum are dropped.
 */
public class LineTokenizer {

    private final int maxArguments;

    public LineTokenizer(int maxArguments) {
        this.maxArguments = maxArguments;
    }

    public TokenizedLine tokenize(String line) {
        int[] starts = new int[maxArguments];
        int[] lengths = new int[maxArguments];
        int count = 0;
        int argLength = 0;
        int pos = 0;
        while (pos < line.length() && count < maxArguments) {
            boolean isArg = !isSeparator(line.charAt(pos));
            if (argLength == 0 && isArg) {
                starts[count] = pos;
                argLength = 1;
            } else if (argLength > 0 && !isArg) {
                lengths[count] = argLength;
                argLength = 0;
                count++;
            } else if (isArg) {
                argLength++;
            }
            pos++;
        }
        if (argLength > 0) {
            lengths[count] = argLength;
            count++;
        }
        return new TokenizedLine(line, starts, lengths, count);
    }

    public static boolean isSeparator(char c) {
        return c == ' ' || c == '\t' || c == ':' || c == '|' || c == ',';
    }

    /**
     * Splits on any of the delimiter characters. Empty tokens are dropped; tokens are not trimmed.
     */
    public static List<String> splitFlat(String text, String delimiters) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (delimiters.indexOf(c) >= 0) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Like {@link #splitFlat(String, String)} but starts after a fixed offset, typically the
     * length of the keyword.
     */
    public static List<String> splitFlat(String text, int offset, String delimiters) {
        if (offset >= text.length()) {
            return new ArrayList<>();
        }
        return splitFlat(text.substring(offset), delimiters);
    }
}
