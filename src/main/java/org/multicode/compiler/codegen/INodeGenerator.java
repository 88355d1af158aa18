package org.multicode.compiler.codegen;

import org.multicode.graph.Node;

import java.util.List;
import java.util.Optional;

/**
 * Generates C++ for one or more node types.
 * <p>
 * Implementations should be stateless. All statements must be emitted via the provided
 * {@link CodeGenContext}; expressions of other nodes are obtained through the {@link GeneratorHelpers}.
 */
public interface INodeGenerator {

	/**
	 * @return The node-type tags this generator serves.
	 */
	List<String> nodeTypes();

	/**
	 * Emits the statements of a node visited by the execution traversal.
	 *
	 * @param node    The node.
	 * @param ctx     The generation context to emit into.
	 * @param helpers Access to expression resolution and nested traversal.
	 * @return How the traversal continues.
	 */
	NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers);

	/**
	 * Produces the expression of one of the node's output ports. Pure nodes implement only this.
	 *
	 * @param node    The node.
	 * @param portId  The id of the requested output port, as found on the data edge.
	 * @param ctx     The generation context.
	 * @param helpers Access to expression resolution.
	 * @return The expression, or empty if the node yields no value.
	 */
	default Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
		return Optional.empty();
	}
}
