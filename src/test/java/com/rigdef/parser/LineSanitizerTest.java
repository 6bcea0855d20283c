package com.rigdef.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LineSanitizer.
 */
class LineSanitizerTest {

    private final LineSanitizer sanitizer = new LineSanitizer(2000);

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "\t\t", "; a comment", "   ;indented comment", "// slashes", "/x" })
    void testPrepareSkipsBlankAndCommentLines(String raw) {
        assertThat(sanitizer.prepare(raw)).isNull();
    }

    @Test
    void testPrepareRemovesLeadingWhitespaceOnly() {
        assertThat(sanitizer.prepare("\t  nodes  ")).isEqualTo("nodes  ");
    }

    @Test
    void testPrepareTruncatesLongLines() {
        LineSanitizer shortLines = new LineSanitizer(5);

        assertThat(shortLines.prepare("abcdefgh")).isEqualTo("abcde");
    }

    @Test
    void testPrepareNullLine() {
        assertThat(sanitizer.prepare(null)).isNull();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1, 2 ; trailing note       | '1, 2 '",
            "1, 2 // trailing note      | '1, 2'",
            "1, 2                       | '1, 2'",
            "a ;b ;c                    | 'a '"
    })
    void testStripTrailingComment(String line, String expected) {
        assertThat(LineSanitizer.stripTrailingComment(line.trim())).isEqualTo(expected);
    }

    @Test
    void testSlashInsideValueIsTreatedAsComment() {
        // Legacy heuristic: the last slash starts a comment even inside a material name
        assertThat(LineSanitizer.stripTrailingComment("tracks/beam")).isEqualTo("tracks");
        assertThat(LineSanitizer.stripTrailingComment("a b //")).isEqualTo("a b");
    }

    @Test
    void testCleanTrimsResult() {
        assertThat(sanitizer.clean("  1, 2, 3   ; comment")).isEqualTo("1, 2, 3");
    }
}
