package org.multicode.compiler.api;

import org.multicode.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The value returned by a generation: the code, all diagnostics and the source map.
 * Generation problems never escape as exceptions.
 *
 * @param success   {@code true} if no error was reported.
 * @param code      The generated source text, empty when preflight failed.
 * @param errors    Errors in report order.
 * @param warnings  Warnings in report order.
 * @param sourceMap Line ranges per visited node.
 * @param stats     Generation statistics.
 */
public record GenerationResult(
        boolean success,
        String code,
        List<Diagnostic> errors,
        List<Diagnostic> warnings,
        List<SourceMapEntry> sourceMap,
        GenerationStats stats
) {
    public GenerationResult {
        code = code != null ? code : "";
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        sourceMap = List.copyOf(sourceMap);
    }

    /**
     * Creates the result of a failed preflight.
     *
     * @param errors           The preflight errors.
     * @param generationTimeMs Elapsed time.
     * @return An unsuccessful result with empty code.
     */
    public static GenerationResult preflightFailure(List<Diagnostic> errors, long generationTimeMs) {
        return new GenerationResult(false, "", errors, List.of(), List.of(), new GenerationStats(0, 0, generationTimeMs));
    }
}
