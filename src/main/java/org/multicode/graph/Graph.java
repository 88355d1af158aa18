package org.multicode.graph;

import java.util.List;
import java.util.Optional;

/**
 * A complete program graph as handed over by the authoring surface.
 * Compilation requires exactly one node of type {@link NodeTypes#START}.
 *
 * @param id        The graph id.
 * @param name      The graph name, written into the generated header.
 * @param nodes     All nodes.
 * @param edges     All execution and data edges.
 * @param functions User-defined functions, each with its own sub-graph.
 */
public record Graph(
        String id,
        String name,
        List<Node> nodes,
        List<Edge> edges,
        List<GraphFunction> functions
) implements NodeGraph {
    public Graph {
        id = id != null ? id : "";
        name = name != null ? name : "";
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
    }

    /**
     * Creates a graph without functions.
     */
    public static Graph of(String name, List<Node> nodes, List<Edge> edges) {
        return new Graph(name, name, nodes, edges, List.of());
    }

    /**
     * @param functionId The function id.
     * @return The function with the given id.
     */
    public Optional<GraphFunction> findFunction(String functionId) {
        return functions.stream().filter(f -> f.id().equals(functionId)).findFirst();
    }
}
