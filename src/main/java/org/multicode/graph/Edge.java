package org.multicode.graph;

/**
 * A directed link from an output port to an input port.
 *
 * @param id         The edge id.
 * @param sourceNode Id of the node owning the source port.
 * @param sourcePort Id of the output port.
 * @param targetNode Id of the node owning the target port.
 * @param targetPort Id of the input port.
 * @param kind       Execution or data; when absent, inferred from {@code dataType}.
 * @param dataType   The data type carried by a data edge, may be {@code null}.
 */
public record Edge(
        String id,
        String sourceNode,
        String sourcePort,
        String targetNode,
        String targetPort,
        EdgeKind kind,
        PortDataType dataType
) {
    public Edge {
        if (kind == null) {
            kind = dataType != null && dataType != PortDataType.EXECUTION ? EdgeKind.DATA : EdgeKind.EXECUTION;
        }
    }

    /**
     * Creates an execution edge.
     */
    public static Edge execution(String id, String sourceNode, String sourcePort, String targetNode, String targetPort) {
        return new Edge(id, sourceNode, sourcePort, targetNode, targetPort, EdgeKind.EXECUTION, PortDataType.EXECUTION);
    }

    /**
     * Creates a data edge.
     */
    public static Edge data(String id, String sourceNode, String sourcePort, String targetNode, String targetPort) {
        return new Edge(id, sourceNode, sourcePort, targetNode, targetPort, EdgeKind.DATA, null);
    }

    public boolean isExecution() {
        return kind == EdgeKind.EXECUTION;
    }
}
