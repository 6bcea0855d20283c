package com.rigdef.parser;

/**
 * Processes one line: a directive line or a data line of an open section.
 */
@FunctionalInterface
public interface KeywordHandler {

    void handle(ParserContext ctx);
}
