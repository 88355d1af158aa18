package org.multicode.testutils;

import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.graph.Edge;
import org.multicode.graph.Graph;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeFactory;
import org.multicode.graph.Port;
import org.multicode.graph.SubGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent construction of test graphs. Port ids follow the {@code <nodeId>-<key>} convention of
 * {@link NodeFactory}.
 */
public final class GraphBuilder {

    /** Options producing only the traversal output: no header, no main wrapper, no label comments. */
    public static final CodeGenOptions BARE = CodeGenOptions.defaults()
            .withIncludeHeaders(false)
            .withGenerateEntryWrapper(false)
            .withIncludeComments(false);

    private final String name;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<GraphFunction> functions = new ArrayList<>();
    private int edgeCounter;

    public GraphBuilder(String name) {
        this.name = name;
    }

    /**
     * Adds a built-in node with default ports.
     */
    public GraphBuilder node(String type, String id) {
        nodes.add(NodeFactory.create(type, id));
        return this;
    }

    /**
     * Adds a prepared node.
     */
    public GraphBuilder node(Node node) {
        nodes.add(node);
        return this;
    }

    /**
     * Connects {@code <from>-<fromKey>} to {@code <to>-exec-in}.
     */
    public GraphBuilder exec(String from, String fromKey, String to) {
        edges.add(Edge.execution("e" + (++edgeCounter), from, from + "-" + fromKey, to, to + "-exec-in"));
        return this;
    }

    /**
     * Connects {@code <from>-exec-out} to {@code <to>-exec-in}.
     */
    public GraphBuilder exec(String from, String to) {
        return exec(from, "exec-out", to);
    }

    /**
     * Connects data output {@code <from>-<fromKey>} to input {@code <to>-<toKey>}.
     */
    public GraphBuilder data(String from, String fromKey, String to, String toKey) {
        edges.add(Edge.data("e" + (++edgeCounter), from, from + "-" + fromKey, to, to + "-" + toKey));
        return this;
    }

    public GraphBuilder function(GraphFunction function) {
        functions.add(function);
        return this;
    }

    public Graph build() {
        return new Graph(name, name, nodes, edges, functions);
    }

    /**
     * @return The nodes and edges as a function body.
     */
    public SubGraph buildBody() {
        return new SubGraph(nodes, edges);
    }

    /**
     * @return A copy of the node with the user value of an input port set.
     */
    public static Node withInput(Node node, String key, Object value) {
        List<Port> inputs = node.inputs().stream()
                .map(p -> p.matchesKey(key) ? p.withValue(value) : p)
                .toList();
        return node.withInputs(inputs);
    }

    /**
     * @return A copy of the node with one more property.
     */
    public static Node withProperty(Node node, String key, Object value) {
        Map<String, Object> properties = new LinkedHashMap<>(node.properties());
        properties.put(key, value);
        return node.withProperties(properties);
    }

    /**
     * @return A copy of the node with another label.
     */
    public static Node withLabel(Node node, String label) {
        return new Node(node.id(), node.type(), label, node.position(), node.inputs(), node.outputs(),
                node.properties(), node.comment());
    }
}
