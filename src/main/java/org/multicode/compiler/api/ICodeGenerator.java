package org.multicode.compiler.api;

import org.multicode.graph.Graph;

import java.util.List;

/**
 * Defines the public interface of a graph-to-source code generator.
 */
public interface ICodeGenerator {

    /**
     * Generates source code for the given graph.
     *
     * @param graph   The program graph.
     * @param options The generation options.
     * @return The result holding code, diagnostics and source map. Never throws for graph problems.
     */
    GenerationResult generate(Graph graph, CodeGenOptions options);

    /**
     * Generates with {@link CodeGenOptions#defaults()}.
     */
    default GenerationResult generate(Graph graph) {
        return generate(graph, CodeGenOptions.defaults());
    }

    /**
     * Runs the preflight checks without generating.
     *
     * @param graph The program graph.
     * @return The preflight outcome.
     */
    PreflightResult canGenerate(Graph graph);

    /**
     * @return The node-type tags this generator can handle, in registration order.
     */
    List<String> getSupportedNodeTypes();

    /**
     * @return The language this generator produces.
     */
    TargetLanguage getLanguage();
}
