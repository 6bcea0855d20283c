package com.rigdef.parser;

/**
 * Cleans raw lines before tokenizing.
 */
public class LineSanitizer {

    private final int maxLineLength;

    public LineSanitizer(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    /**
     * Truncates the line and removes leading whitespace.
     *
     * @return the line, or {@code null} when it is blank or a comment line
     */
    public String prepare(String raw) {
        if (raw == null) {
            return null;
        }
        String line = raw.length() > maxLineLength ? raw.substring(0, maxLineLength) : raw;
        int start = 0;
        while (start < line.length() && isWhitespace(line.charAt(start))) {
            start++;
        }
        if (start == line.length()) {
            return null;
        }
        char first = line.charAt(start);
        if (first == ';' || first == '/') {
            return null;
        }
        return line.substring(start);
    }

    /**
     * Full cleanup of a prepared line: trailing comment removed, surrounding whitespace trimmed.
     */
    public String clean(String prepared) {
        return stripTrailingComment(prepared).trim();
    }

    /**
     * Removes a trailing comment. A ';' starts a comment anywhere. Without one, the comment starts
     * at the last '/' extended backwards over slashes and blanks.
     */
    public static String stripTrailingComment(String line) {
        int semicolon = line.indexOf(';');
        if (semicolon >= 0) {
            return line.substring(0, semicolon);
        }
        int slash = line.lastIndexOf('/');
        if (slash < 0) {
            return line;
        }
        int cut = slash;
        while (cut > 0) {
            char c = line.charAt(cut - 1);
            if (c != '/' && c != ' ' && c != '\t') {
                break;
            }
            cut--;
        }
        return line.substring(0, cut);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t';
    }
}
