package org.multicode.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error or warning) produced while checking or
 * generating a graph.
 *
 * @param type    The type of the diagnostic.
 * @param code    The machine-readable kind.
 * @param nodeId  The offending node, or an empty string for graph-level problems.
 * @param message The human-readable message.
 */
public record Diagnostic(
        Type type,
        DiagnosticCode code,
        String nodeId,
        String message
) {
    public Diagnostic {
        nodeId = nodeId != null ? nodeId : "";
    }

    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that makes the generation unsuccessful. */
        ERROR,
        /** A problem that does not prevent generation. */
        WARNING
    }

    /**
     * @return {@code true} if this diagnostic is an error.
     */
    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        String location = nodeId.isEmpty() ? "<graph>" : nodeId;
        return String.format("[%s] %s %s: %s", type, code.name(), location, message);
    }
}
