package com.rigdef.parser;

/**
 * Argument spans over a line. Argument text is only copied out of the line when requested.
 */
public class TokenizedLine implements Arguments {

    private final String line;
    private final int[] starts;
    private final int[] lengths;
    private final int count;

    TokenizedLine(String line, int[] starts, int[] lengths, int count) {
        this.line = line;
        this.starts = starts;
        this.lengths = lengths;
        this.count = count;
    }

    public String getLine() {
        return line;
    }

    @Override
    public int count() {
        return count;
    }

    @Override
    public String get(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Argument " + index + " of " + count);
        }
        return line.substring(starts[index], starts[index] + lengths[index]);
    }

    public int start(int index) {
        return starts[index];
    }

    public int length(int index) {
        return lengths[index];
    }
}
