package org.multicode.compiler.codegen.features.variables;

import org.multicode.compiler.codegen.Identifiers;
import org.multicode.graph.Node;

/**
 * Identity of the logical variable behind {@code Variable}, {@code GetVariable} and
 * {@code SetVariable} nodes.
 */
final class VariableNodes {

    static final String VARIABLE_ID = "variableId";
    static final String VARIABLE_NAME = "variableName";

    private VariableNodes() {}

    /**
     * @return The {@code variableId} property, else {@code var:<sanitized name>}.
     */
    static String stableId(Node node) {
        return node.property(VARIABLE_ID)
                .filter(id -> !id.isBlank())
                .orElseGet(() -> "var:" + Identifiers.toIdentifier(displayName(node)));
    }

    /**
     * @return The {@code variableName} property, else the node label.
     */
    static String displayName(Node node) {
        return node.property(VARIABLE_NAME)
                .filter(name -> !name.isBlank())
                .orElse(node.label());
    }
}
