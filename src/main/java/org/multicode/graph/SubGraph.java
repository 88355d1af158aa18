package org.multicode.graph;

import java.util.List;

/**
 * The body of a user-defined function.
 */
public record SubGraph(List<Node> nodes, List<Edge> edges) implements NodeGraph {
    public SubGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
