package com.rigdef.parser;

import java.util.Map;

/**
 * Family of related keyword handlers.
 */
public interface ExtractorGroup {

    void registerInto(Map<Keyword, KeywordHandler> handlers);
}
