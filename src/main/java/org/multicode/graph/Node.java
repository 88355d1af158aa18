package org.multicode.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node of a program graph. Identity is the {@code id}; uniqueness across a graph is assumed.
 *
 * @param id         The node id.
 * @param type       The node-type tag, e.g. {@code "Branch"} or a package-supplied tag.
 * @param label      The label shown to the author.
 * @param position   Editor position; ignored by the compiler.
 * @param inputs     Input ports in display order.
 * @param outputs    Output ports in display order.
 * @param properties Free-form node properties (variable ids, function ids, template props).
 * @param comment    Optional free text, used by comment nodes.
 */
public record Node(
        String id,
        String type,
        String label,
        Position position,
        List<Port> inputs,
        List<Port> outputs,
        Map<String, Object> properties,
        String comment
) {
    public Node {
        if (id == null) throw new IllegalArgumentException("Node id must not be null");
        label = label != null ? label : "";
        position = position != null ? position : Position.ORIGIN;
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
    }

    /**
     * Finds the input port addressed by the given key.
     *
     * @param key The port key (see {@link Port#matchesKey(String)}).
     * @return The first matching input port.
     */
    public Optional<Port> findInput(String key) {
        return inputs.stream().filter(p -> p.matchesKey(key)).findFirst();
    }

    /**
     * Finds the data input port addressed by the given key, skipping execution ports so that
     * a key such as {@code "in"} does not match {@code "<id>-exec-in"}.
     *
     * @param key The port key.
     * @return The first matching data input port.
     */
    public Optional<Port> findDataInput(String key) {
        return inputs.stream().filter(p -> !p.isExecution() && p.matchesKey(key)).findFirst();
    }

    /**
     * Finds the output port addressed by the given key.
     *
     * @param key The port key.
     * @return The first matching output port.
     */
    public Optional<Port> findOutput(String key) {
        return outputs.stream().filter(p -> p.matchesKey(key)).findFirst();
    }

    /**
     * @return {@code true} if the node has at least one execution output.
     */
    public boolean hasExecutionOutput() {
        return outputs.stream().anyMatch(Port::isExecution);
    }

    /**
     * Returns a property as text.
     *
     * @param name The property name.
     * @return The property rendered with {@link String#valueOf(Object)}, or empty if absent.
     */
    public Optional<String> property(String name) {
        Object value = properties.get(name);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    /**
     * @param newInputs The replacement input ports.
     * @return A copy of this node with the given inputs.
     */
    public Node withInputs(List<Port> newInputs) {
        return new Node(id, type, label, position, newInputs, outputs, properties, comment);
    }

    /**
     * @param newProperties The replacement properties.
     * @return A copy of this node with the given properties.
     */
    public Node withProperties(Map<String, Object> newProperties) {
        return new Node(id, type, label, position, inputs, outputs, newProperties, comment);
    }

    /**
     * Cosmetic editor position.
     */
    public record Position(double x, double y) {
        public static final Position ORIGIN = new Position(0, 0);
    }
}
