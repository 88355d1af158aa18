package org.multicode.compiler.diagnostics;

/**
 * Warning kinds. Warnings never affect the success of a generation.
 */
public enum CodeGenWarningCode implements DiagnosticCode {
    UNUSED_NODE,
    UNINITIALIZED_VARIABLE,
    EMPTY_BRANCH,
    INFINITE_LOOP,
    DIVISION_BY_ZERO,
    MODULO_BY_ZERO,
    /** Best-effort hint: a data edge connects ports of incompatible types. */
    TYPE_MISMATCH
}
