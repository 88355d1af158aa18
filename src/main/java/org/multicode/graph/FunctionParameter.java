package org.multicode.graph;

/**
 * An input or output parameter of a user-defined function.
 *
 * @param id        Stable parameter id; also the port key on call and return nodes.
 * @param name      Display name, may be non-Latin.
 * @param dataType  Parameter type.
 * @param direction {@link PortDirection#INPUT} for arguments, {@link PortDirection#OUTPUT} for results.
 */
public record FunctionParameter(String id, String name, PortDataType dataType, PortDirection direction) {
    public FunctionParameter {
        name = name != null ? name : id;
        dataType = dataType != null ? dataType : PortDataType.ANY;
        direction = direction != null ? direction : PortDirection.INPUT;
    }

    public static FunctionParameter input(String id, String name, PortDataType dataType) {
        return new FunctionParameter(id, name, dataType, PortDirection.INPUT);
    }

    public static FunctionParameter output(String id, String name, PortDataType dataType) {
        return new FunctionParameter(id, name, dataType, PortDirection.OUTPUT);
    }
}
