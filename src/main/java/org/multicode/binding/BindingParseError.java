package org.multicode.binding;

/**
 * @param kind    The problem.
 * @param line    The 1-based line the problem was found on.
 * @param message A human-readable description.
 */
public record BindingParseError(BindingErrorKind kind, int line, String message) {

    @Override
    public String toString() {
        return kind + " at line " + line + ": " + message;
    }
}
