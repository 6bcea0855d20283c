package com.rigdef.parser;

/**
 * Positional arguments of one line.
 */
public interface Arguments {

    int count();

    String get(int index);
}
