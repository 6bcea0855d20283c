package com.rigdef.parser;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Identifies the keyword a sanitized line starts with.
 *
 * A keyword must be followed by a separator or the end of the line. The exact spelling is tried
 * first, then any letter case.
 */
public class KeywordResolver {

    private static final Map<String, Keyword> BY_TEXT = new HashMap<>();

    private static final Pattern RESPECT_CASE;
    private static final Pattern IGNORE_CASE;

    static {
        for (Keyword keyword : Keyword.values()) {
            BY_TEXT.put(keyword.getText().toLowerCase(Locale.ROOT), keyword);
        }
        // Longest first so that "nodes2" wins over "nodes" and "end_section" over "end"
        String alternatives = Arrays.stream(Keyword.values())
                .map(Keyword::getText)
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        String regex = "^(" + alternatives + ")(?=[\\s,:|]|$)";
        RESPECT_CASE = Pattern.compile(regex);
        IGNORE_CASE = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * @return the keyword, or {@code null} when the line does not start with one
     */
    public Keyword resolve(String line) {
        if (line == null || line.isEmpty() || !isAsciiLetter(line.charAt(0))) {
            return null;
        }
        Keyword keyword = match(RESPECT_CASE, line);
        if (keyword != null) {
            return keyword;
        }
        return match(IGNORE_CASE, line);
    }

    private static Keyword match(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        return BY_TEXT.get(matcher.group(1).toLowerCase(Locale.ROOT));
    }

    private static boolean isAsciiLetter(char c) {
        char lower = Character.toLowerCase(c);
        return lower >= 'a' && lower <= 'z';
    }
}
