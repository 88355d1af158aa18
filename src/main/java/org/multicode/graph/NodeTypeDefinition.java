package org.multicode.graph;

import java.util.List;

/**
 * Template for creating nodes of a built-in type.
 *
 * @param type     The node-type tag.
 * @param label    The default label of new nodes.
 * @param category The palette category.
 * @param inputs   Input port templates.
 * @param outputs  Output port templates.
 */
public record NodeTypeDefinition(
        String type,
        String label,
        NodeCategory category,
        List<PortTemplate> inputs,
        List<PortTemplate> outputs
) {
    public NodeTypeDefinition {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /**
     * A port of a {@link NodeTypeDefinition}. Instances get the id {@code <nodeId>-<key>}.
     *
     * @param key          The port key.
     * @param name         The display name.
     * @param dataType     The data type.
     * @param defaultValue The declared default, or {@code null}.
     */
    public record PortTemplate(String key, String name, PortDataType dataType, Object defaultValue) {

        public static PortTemplate exec(String key) {
            return new PortTemplate(key, "", PortDataType.EXECUTION, null);
        }

        public static PortTemplate of(String key, String name, PortDataType dataType) {
            return new PortTemplate(key, name, dataType, null);
        }

        public static PortTemplate of(String key, String name, PortDataType dataType, Object defaultValue) {
            return new PortTemplate(key, name, dataType, defaultValue);
        }
    }
}
