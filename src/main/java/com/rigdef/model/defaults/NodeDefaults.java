package com.rigdef.model.defaults;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.element.NodeOption;

import lombok.Builder;
import lombok.Value;

/**
 * Node defaults set by "set_node_defaults". Immutable once published.
 */
@Value
@Builder(toBuilder = true)
public class NodeDefaults {

    public static final NodeDefaults BUILTIN = NodeDefaults.builder().build();

    /** Load weight; {@code -1} means the engine computes it. */
    @Builder.Default
    float loadWeight = -1f;

    @Builder.Default
    float friction = 1f;

    @Builder.Default
    float volume = 1f;

    @Builder.Default
    float surface = 1f;

    @Builder.Default
    Set<NodeOption> options = Collections.unmodifiableSet(EnumSet.noneOf(NodeOption.class));
}
