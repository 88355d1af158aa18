package org.multicode.graph;

import java.util.List;

/**
 * A user-defined function. Its sub-graph contains a {@link NodeTypes#FUNCTION_ENTRY} node where
 * execution starts and a {@link NodeTypes#FUNCTION_RETURN} node whose inputs mirror the output
 * parameters.
 *
 * @param id          The function id, referenced by call nodes through the {@code functionId} property.
 * @param name        The display name.
 * @param description Optional documentation, emitted as a comment.
 * @param parameters  Parameters in declaration order.
 * @param graph       The function body.
 */
public record GraphFunction(
        String id,
        String name,
        String description,
        List<FunctionParameter> parameters,
        SubGraph graph
) {
    public GraphFunction {
        name = name != null ? name : id;
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        graph = graph != null ? graph : new SubGraph(List.of(), List.of());
    }

    /**
     * @return The input parameters in declaration order.
     */
    public List<FunctionParameter> inputs() {
        return parameters.stream().filter(p -> p.direction() == PortDirection.INPUT).toList();
    }

    /**
     * @return The output parameters in declaration order.
     */
    public List<FunctionParameter> outputs() {
        return parameters.stream().filter(p -> p.direction() == PortDirection.OUTPUT).toList();
    }
}
