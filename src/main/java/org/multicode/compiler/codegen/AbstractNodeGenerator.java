package org.multicode.compiler.codegen;

import java.util.List;

/**
 * Base class for generators with a fixed list of node types.
 */
public abstract class AbstractNodeGenerator implements INodeGenerator {

	private final List<String> nodeTypes;

	protected AbstractNodeGenerator(String... nodeTypes) {
		this.nodeTypes = List.of(nodeTypes);
	}

	@Override
	public final List<String> nodeTypes() {
		return nodeTypes;
	}
}
