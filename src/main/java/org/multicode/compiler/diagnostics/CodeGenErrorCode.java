package org.multicode.compiler.diagnostics;

/**
 * Error kinds. Any error makes a generation unsuccessful.
 */
public enum CodeGenErrorCode implements DiagnosticCode {
    /** The graph has no {@code Start} node. */
    NO_START_NODE,
    /** The graph has more than one {@code Start} node. */
    MULTIPLE_START_NODES,
    /** A cycle in the execution flow. Part of the taxonomy, traversal truncates cycles silently. */
    CYCLE_DETECTED,
    /** A required input port has neither an edge nor a value. */
    UNCONNECTED_REQUIRED_PORT,
    /** No generator is registered for a node type. */
    UNKNOWN_NODE_TYPE,
    /** A call node references a function that does not exist. */
    UNKNOWN_FUNCTION
}
