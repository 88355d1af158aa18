package org.multicode.compiler.codegen.features.template;

/**
 * A configurable property of a package node.
 *
 * @param id           The property id, referenced as {@code {{prop.<id>}}}.
 * @param name         The display name.
 * @param type         The property type as declared by the package.
 * @param defaultValue The value used when the node does not set the property, or {@code null}.
 */
public record PropertyDefinition(String id, String name, String type, Object defaultValue) {
}
