package org.multicode.binding;

/**
 * Structural problems of binding markers.
 */
public enum BindingErrorKind {
    /** A begin marker while another block is open. Blocks cannot be nested. */
    NESTED_BEGIN,
    /** An end marker without an open block. */
    ORPHAN_END,
    /** Begin and end marker carry different ids. */
    MISMATCHED_IDS,
    /** End of file reached with an open block. */
    UNCLOSED_BEGIN
}
