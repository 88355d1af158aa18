package org.multicode.compiler.codegen;

/**
 * A logical variable bound to a C++ identifier.
 *
 * @param variableId   The stable logical id.
 * @param codeName     The identifier used in generated code.
 * @param originalName The display name it was derived from.
 * @param cppType      The declared C++ type.
 * @param ownerNodeId  The node that introduced the binding.
 */
public record VariableBinding(
		String variableId,
		String codeName,
		String originalName,
		String cppType,
		String ownerNodeId
) {
}
