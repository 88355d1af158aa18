package org.multicode.compiler.codegen;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * What the generated body needs from the file header. One instance per generation call,
 * shared by the main traversal and all function bodies of that call.
 */
public final class HeaderRequirements {

	private final Set<String> includes = new TreeSet<>();
	private boolean tupleSupport;

	/**
	 * Registers an include directive argument such as {@code <cmath>} or {@code "my.h"}.
	 *
	 * @param include The include target.
	 */
	public void addInclude(String include) {
		if (include != null && !include.isBlank()) {
			includes.add(include.trim());
		}
	}

	/**
	 * Marks that the body constructs or destructures tuples.
	 */
	public void requireTupleSupport() {
		tupleSupport = true;
	}

	/**
	 * @return {@code true} if {@code <tuple>} is needed.
	 */
	public boolean requiresTupleSupport() {
		return tupleSupport;
	}

	/**
	 * @return The contributed includes, sorted.
	 */
	public Set<String> includes() {
		return Collections.unmodifiableSet(includes);
	}
}
