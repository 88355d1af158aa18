package org.multicode.graph;

/**
 * Palette categories of the built-in node types.
 */
public enum NodeCategory {
    FLOW,
    FUNCTION,
    VARIABLE,
    MATH,
    COMPARISON,
    LOGIC,
    IO,
    OTHER
}
