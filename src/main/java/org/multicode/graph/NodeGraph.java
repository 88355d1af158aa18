package org.multicode.graph;

import java.util.List;
import java.util.Optional;

/**
 * Nodes and edges of a traversable graph: either a top-level {@link Graph} or the body of a
 * {@link GraphFunction}.
 */
public interface NodeGraph {

    List<Node> nodes();

    List<Edge> edges();

    /**
     * @param nodeId The node id.
     * @return The node with the given id.
     */
    default Optional<Node> findNode(String nodeId) {
        return nodes().stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    /**
     * @param type The node-type tag.
     * @return All nodes of the given type, in node order.
     */
    default List<Node> nodesOfType(String type) {
        return nodes().stream().filter(n -> type.equals(n.type())).toList();
    }
}
