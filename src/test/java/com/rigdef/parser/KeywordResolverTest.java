package com.rigdef.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for KeywordResolver.
 */
class KeywordResolverTest {

    private final KeywordResolver resolver = new KeywordResolver();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "nodes                       | NODES",
            "nodes2                      | NODES2",
            "NODES                       | NODES",
            "end                         | END",
            "end_section                 | END_SECTION",
            "section 1 Wheels            | SECTION",
            "set_beam_defaults 1 2       | SET_BEAM_DEFAULTS",
            "set_beam_defaults_scale 1   | SET_BEAM_DEFAULTS_SCALE",
            "hideInChooser               | HIDEINCHOOSER",
            "hideinchooser               | HIDEINCHOOSER",
            "TractionControl 1000, 10    | TRACTIONCONTROL",
            "beams,                      | BEAMS",
            "author:chassis              | AUTHOR"
    })
    void testResolvesKeyword(String line, Keyword expected) {
        assertThat(resolver.resolve(line.trim())).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "1, 2, 3", "nodesx", "beam", "my rig", "_nodes", "" })
    void testNonKeywordLines(String line) {
        assertThat(resolver.resolve(line)).isNull();
    }

    @Test
    void testNullLine() {
        assertThat(resolver.resolve(null)).isNull();
    }
}
