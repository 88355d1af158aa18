package org.multicode.compiler.codegen;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps logical variable ids to unique C++ identifiers for one traversal scope.
 * <p>
 * A logical id keeps its identifier for the life of the table. A different logical id whose
 * sanitized name is already taken gets a numeric suffix ({@code count_2}, {@code count_3}, ...).
 */
public final class VariableBindingTable {

	private final Map<String, VariableBinding> byId = new LinkedHashMap<>();
	private final Set<String> usedNames = new HashSet<>();

	/**
	 * @param variableId A logical variable id.
	 * @return {@code true} if the id has a binding, which means a later assignment is a reassignment.
	 */
	public boolean isBound(String variableId) {
		return byId.containsKey(variableId);
	}

	/**
	 * @param variableId A logical variable id.
	 * @return The binding, if any.
	 */
	public Optional<VariableBinding> lookup(String variableId) {
		return Optional.ofNullable(byId.get(variableId));
	}

	/**
	 * Binds a logical id to an identifier derived from its display name. Binding an already
	 * bound id returns the existing binding unchanged.
	 *
	 * @param variableId  The logical id.
	 * @param displayName The display name to sanitize.
	 * @param cppType     The C++ type.
	 * @param ownerNodeId The introducing node.
	 * @return The binding.
	 */
	public VariableBinding bind(String variableId, String displayName, String cppType, String ownerNodeId) {
		return bindName(variableId, Identifiers.toIdentifier(displayName), displayName, cppType, ownerNodeId);
	}

	/**
	 * Binds a logical id to an identifier chosen by the caller, for example a loop counter.
	 * The name is still made unique within the table.
	 *
	 * @param variableId   The logical id.
	 * @param codeName     The preferred identifier.
	 * @param originalName The display name.
	 * @param cppType      The C++ type.
	 * @param ownerNodeId  The introducing node.
	 * @return The binding.
	 */
	public VariableBinding bindName(String variableId, String codeName, String originalName, String cppType, String ownerNodeId) {
		VariableBinding existing = byId.get(variableId);
		if (existing != null) return existing;
		VariableBinding binding = new VariableBinding(variableId, uniqueName(codeName), originalName, cppType, ownerNodeId);
		usedNames.add(binding.codeName());
		byId.put(variableId, binding);
		return binding;
	}

	/**
	 * @return The number of bindings.
	 */
	public int size() {
		return byId.size();
	}

	private String uniqueName(String base) {
		if (!usedNames.contains(base)) return base;
		int n = 2;
		while (usedNames.contains(base + "_" + n)) n++;
		return base + "_" + n;
	}
}
