package org.multicode.compiler.diagnostics;

/**
 * A machine-readable diagnostic kind. Implemented by {@link CodeGenErrorCode} and
 * {@link CodeGenWarningCode}.
 */
public interface DiagnosticCode {

    /**
     * @return The stable code name, e.g. {@code "NO_START_NODE"}.
     */
    String name();
}
