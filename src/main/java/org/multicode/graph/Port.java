package org.multicode.graph;

/**
 * A typed connection endpoint on a node.
 * <p>
 * Port ids on node instances are usually prefixed with the owning node id
 * ({@code "n1-exec-out"}); generators address ports by their key ({@code "exec-out"}),
 * see {@link #matchesKey(String)}.
 *
 * @param id           The port id, unique within its node.
 * @param name         The display name, may be empty.
 * @param dataType     The data type; {@link PortDataType#EXECUTION} for control flow.
 * @param direction    Input or output.
 * @param defaultValue The declared default value, or {@code null}.
 * @param value        The value set by the user, or {@code null}.
 */
public record Port(
        String id,
        String name,
        PortDataType dataType,
        PortDirection direction,
        Object defaultValue,
        Object value
) {
    public Port {
        if (id == null) throw new IllegalArgumentException("Port id must not be null");
        name = name != null ? name : "";
        dataType = dataType != null ? dataType : PortDataType.ANY;
        direction = direction != null ? direction : PortDirection.INPUT;
    }

    /**
     * Creates an input port without default or value.
     */
    public static Port input(String id, PortDataType dataType) {
        return new Port(id, "", dataType, PortDirection.INPUT, null, null);
    }

    /**
     * Creates an output port.
     */
    public static Port output(String id, PortDataType dataType) {
        return new Port(id, "", dataType, PortDirection.OUTPUT, null, null);
    }

    /**
     * @param newValue The user value to set.
     * @return A copy of this port carrying the given value.
     */
    public Port withValue(Object newValue) {
        return new Port(id, name, dataType, direction, defaultValue, newValue);
    }

    /**
     * @return {@code true} if this port carries control flow.
     */
    public boolean isExecution() {
        return dataType == PortDataType.EXECUTION;
    }

    /**
     * Checks whether this port is addressed by the given key: either the id equals the key or it
     * ends with {@code "-" + key}.
     *
     * @param key The port key, e.g. {@code "condition"}.
     * @return {@code true} if the id matches.
     */
    public boolean matchesKey(String key) {
        return matchesKey(id, key);
    }

    /**
     * Static form of {@link #matchesKey(String)} for raw port ids found on edges.
     */
    public static boolean matchesKey(String portId, String key) {
        if (portId == null || key == null || key.isEmpty()) return false;
        return portId.equals(key) || portId.endsWith("-" + key);
    }
}
