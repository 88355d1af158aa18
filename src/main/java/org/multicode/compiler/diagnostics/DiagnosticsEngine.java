package org.multicode.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) during preflight and generation.
 * <p>
 * This decouples error reporting from the generators: they report into the engine of their
 * context, and the orchestrator turns the collected diagnostics into the result value.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error kind.
     * @param nodeId  The offending node id, or {@code ""} for graph-level errors.
     * @param message The error message.
     */
    public void reportError(CodeGenErrorCode code, String nodeId, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, nodeId, message));
    }

    /**
     * Reports a warning.
     *
     * @param code    The warning kind.
     * @param nodeId  The node the warning refers to.
     * @param message The warning message.
     */
    public void reportWarning(CodeGenWarningCode code, String nodeId, String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, nodeId, message));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Copies all diagnostics of another engine into this one, keeping their order.
     *
     * @param other The engine to merge from.
     */
    public void mergeFrom(DiagnosticsEngine other) {
        if (other != this) {
            diagnostics.addAll(other.diagnostics);
        }
    }

    /**
     * @return The reported errors in report order.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    /**
     * @return The reported warnings in report order.
     */
    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
