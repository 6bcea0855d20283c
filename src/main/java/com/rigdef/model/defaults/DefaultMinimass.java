package com.rigdef.model.defaults;

import lombok.Value;

/**
 * Minimal node mass set by "set_default_minimass".
 */
@Value
public class DefaultMinimass {
    float minMassKg;
}
