package org.multicode.compiler.api;

import org.multicode.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of {@link ICodeGenerator#canGenerate(org.multicode.graph.Graph)}.
 *
 * @param canGenerate {@code true} if there are no errors.
 * @param errors      The preflight errors.
 */
public record PreflightResult(boolean canGenerate, List<Diagnostic> errors) {
    public PreflightResult {
        errors = List.copyOf(errors);
    }

    public static PreflightResult of(List<Diagnostic> errors) {
        return new PreflightResult(errors.isEmpty(), errors);
    }
}
