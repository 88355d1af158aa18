package org.multicode.compiler.api;

import com.typesafe.config.Config;

/**
 * Options recognized by {@link ICodeGenerator#generate(org.multicode.graph.Graph, CodeGenOptions)}.
 *
 * @param includeComments      Emit {@code // <type label>: <node label>} comments for renamed nodes.
 * @param includeSourceMarkers Wrap each node's code in node-begin/node-end marker comments.
 * @param indentSize           Spaces per indentation level.
 * @param includeHeaders       Emit the header comment and the {@code #include} block.
 * @param generateEntryWrapper Wrap the traversal output in {@code int main() { ... }}.
 */
public record CodeGenOptions(
        boolean includeComments,
        boolean includeSourceMarkers,
        int indentSize,
        boolean includeHeaders,
        boolean generateEntryWrapper
) {
    private static final CodeGenOptions DEFAULTS = new CodeGenOptions(true, false, 4, true, true);

    public CodeGenOptions {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
    }

    /**
     * @return The default options: comments on, markers off, indent 4, headers on, wrapper on.
     */
    public static CodeGenOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Builds options from a {@code multicode.codegen} style config subtree. Missing keys keep
     * their defaults.
     *
     * @param config The subtree holding {@code include-comments}, {@code indent-size}, ...
     * @return The options.
     */
    public static CodeGenOptions fromConfig(Config config) {
        return new CodeGenOptions(
                config.hasPath("include-comments") ? config.getBoolean("include-comments") : DEFAULTS.includeComments,
                config.hasPath("include-source-markers") ? config.getBoolean("include-source-markers") : DEFAULTS.includeSourceMarkers,
                config.hasPath("indent-size") ? config.getInt("indent-size") : DEFAULTS.indentSize,
                config.hasPath("include-headers") ? config.getBoolean("include-headers") : DEFAULTS.includeHeaders,
                config.hasPath("generate-entry-wrapper") ? config.getBoolean("generate-entry-wrapper") : DEFAULTS.generateEntryWrapper
        );
    }

    public CodeGenOptions withIncludeComments(boolean value) {
        return new CodeGenOptions(value, includeSourceMarkers, indentSize, includeHeaders, generateEntryWrapper);
    }

    public CodeGenOptions withIncludeSourceMarkers(boolean value) {
        return new CodeGenOptions(includeComments, value, indentSize, includeHeaders, generateEntryWrapper);
    }

    public CodeGenOptions withIndentSize(int value) {
        return new CodeGenOptions(includeComments, includeSourceMarkers, value, includeHeaders, generateEntryWrapper);
    }

    public CodeGenOptions withIncludeHeaders(boolean value) {
        return new CodeGenOptions(includeComments, includeSourceMarkers, indentSize, value, generateEntryWrapper);
    }

    public CodeGenOptions withGenerateEntryWrapper(boolean value) {
        return new CodeGenOptions(includeComments, includeSourceMarkers, indentSize, includeHeaders, value);
    }
}
