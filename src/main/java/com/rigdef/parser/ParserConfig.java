package com.rigdef.parser;

import com.rigdef.resource.ResourceLocator;

import lombok.Builder;
import lombok.Value;

/**
 * Parser settings. Defaults match the behavior expected by existing vehicle files.
 */
@Value
@Builder(toBuilder = true)
public class ParserConfig {

    public static final ParserConfig DEFAULT = ParserConfig.builder().build();

    /** Longer lines are truncated. */
    @Builder.Default
    int maxLineLength = 2000;

    /** Arguments beyond this count are dropped by the tokenizer. */
    @Builder.Default
    int maxArguments = 100;

    /** Resource group passed to the {@link ResourceLocator}. */
    @Builder.Default
    String resourceGroup = "General";

    @Builder.Default
    ResourceLocator resourceLocator = ResourceLocator.ANY;

    /** Keep numeric/named node references ambiguous until the end of the file. */
    @Builder.Default
    boolean sequentialImport = true;

    /** "fileformatversion" from which node references are named-only. */
    @Builder.Default
    int modernFormatVersion = 450;
}
