package org.multicode.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates node instances from the built-in catalogue. Port ids are {@code <nodeId>-<key>}.
 */
public final class NodeFactory {

    private NodeFactory() {}

    /**
     * Creates a node with the default label of its type.
     *
     * @param type   A built-in node-type tag.
     * @param nodeId The id of the new node.
     * @return The node with all ports of the type.
     * @throws IllegalArgumentException if the type is not built in.
     */
    public static Node create(String type, String nodeId) {
        NodeTypeDefinition def = NodeTypes.definition(type)
                .orElseThrow(() -> new IllegalArgumentException("Unknown built-in node type: " + type));
        List<Port> inputs = def.inputs().stream()
                .map(t -> new Port(nodeId + "-" + t.key(), t.name(), t.dataType(), PortDirection.INPUT, t.defaultValue(), null))
                .toList();
        List<Port> outputs = def.outputs().stream()
                .map(t -> new Port(nodeId + "-" + t.key(), t.name(), t.dataType(), PortDirection.OUTPUT, t.defaultValue(), null))
                .toList();
        return new Node(nodeId, type, def.label(), Node.Position.ORIGIN, inputs, outputs, Map.of(), null);
    }

    /**
     * Creates the entry node of a function body. It exposes one data output per input parameter.
     */
    public static Node functionEntry(GraphFunction function, String nodeId) {
        List<Port> outputs = new ArrayList<>();
        outputs.add(Port.output(nodeId + "-exec-out", PortDataType.EXECUTION));
        for (FunctionParameter p : function.inputs()) {
            outputs.add(new Port(nodeId + "-" + p.id(), p.name(), p.dataType(), PortDirection.OUTPUT, null, null));
        }
        return new Node(nodeId, NodeTypes.FUNCTION_ENTRY, function.name(), null, List.of(), outputs,
                Map.of("functionId", function.id()), null);
    }

    /**
     * Creates the return node of a function body. Its data inputs mirror the output parameters.
     */
    public static Node functionReturn(GraphFunction function, String nodeId) {
        List<Port> inputs = new ArrayList<>();
        inputs.add(Port.input(nodeId + "-exec-in", PortDataType.EXECUTION));
        for (FunctionParameter p : function.outputs()) {
            inputs.add(new Port(nodeId + "-" + p.id(), p.name(), p.dataType(), PortDirection.INPUT, null, null));
        }
        return new Node(nodeId, NodeTypes.FUNCTION_RETURN, NodeTypes.defaultLabel(NodeTypes.FUNCTION_RETURN), null,
                inputs, List.of(), Map.of("functionId", function.id()), null);
    }

    /**
     * Creates a call node for a user-defined function, with one data port per parameter.
     */
    public static Node callFunction(GraphFunction function, String nodeId) {
        List<Port> inputs = new ArrayList<>();
        inputs.add(Port.input(nodeId + "-exec-in", PortDataType.EXECUTION));
        for (FunctionParameter p : function.inputs()) {
            inputs.add(new Port(nodeId + "-" + p.id(), p.name(), p.dataType(), PortDirection.INPUT, null, null));
        }
        List<Port> outputs = new ArrayList<>();
        outputs.add(Port.output(nodeId + "-exec-out", PortDataType.EXECUTION));
        for (FunctionParameter p : function.outputs()) {
            outputs.add(new Port(nodeId + "-" + p.id(), p.name(), p.dataType(), PortDirection.OUTPUT, null, null));
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("functionId", function.id());
        properties.put("functionName", function.name());
        return new Node(nodeId, NodeTypes.CALL_USER_FUNCTION, function.name(), null, inputs, outputs, properties, null);
    }
}
