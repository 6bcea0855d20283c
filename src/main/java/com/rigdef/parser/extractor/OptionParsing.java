package com.rigdef.parser.extractor;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.diagnostics.DiagnosticsReporter;
import com.rigdef.model.element.NodeOption;

/**
 * Option-string helpers shared by several extractor groups.
 */
final class OptionParsing {

    private OptionParsing() {
    }

    /**
     * Parses node option characters. 'n' and 'm' cancel each other; the last one wins.
     */
    static Set<NodeOption> nodeOptions(String text, DiagnosticsReporter reporter) {
        Set<NodeOption> options = EnumSet.noneOf(NodeOption.class);
        for (char c : text.toCharArray()) {
            NodeOption option = NodeOption.fromCode(c);
            if (option == null) {
                reporter.warning("invalid option '" + c + "'");
                continue;
            }
            if (option == NodeOption.MOUSE_GRAB) {
                options.remove(NodeOption.NO_MOUSE_GRAB);
            } else if (option == NodeOption.NO_MOUSE_GRAB) {
                options.remove(NodeOption.MOUSE_GRAB);
            }
            options.add(option);
        }
        return options;
    }

    static void warnInvalidOption(DiagnosticsReporter reporter, char c) {
        reporter.warning("ignoring invalid option '" + c + "'");
    }
}
