package org.multicode.compiler.codegen;

import org.multicode.graph.Node;

import java.util.Optional;

/**
 * Helper bundle handed to node generators: expression resolution and nested traversal,
 * bound to one {@link CodeGenContext}.
 */
public final class GeneratorHelpers {

	private final ExecutionTraversal traversal;
	private final ExpressionResolver resolver;
	private final CodeGenContext ctx;

	GeneratorHelpers(ExecutionTraversal traversal, ExpressionResolver resolver, CodeGenContext ctx) {
		this.traversal = traversal;
		this.resolver = resolver;
		this.ctx = ctx;
	}

	/**
	 * @return The context the helpers are bound to.
	 */
	public CodeGenContext context() {
		return ctx;
	}

	/**
	 * Resolves the expression of an input port.
	 *
	 * @param node    The node.
	 * @param portKey The port key.
	 * @return The expression, or empty if the port is unconnected and has no value.
	 */
	public Optional<String> input(Node node, String portKey) {
		return resolver.resolveInput(node, portKey, this);
	}

	/**
	 * Resolves an input port with a fallback expression.
	 */
	public String inputOr(Node node, String portKey, String fallback) {
		return input(node, portKey).orElse(fallback);
	}

	/**
	 * Resolves the expression of another node's output port.
	 */
	public String output(Node node, String portId) {
		return resolver.resolveOutput(node, portId, this);
	}

	/**
	 * @param node    The node.
	 * @param portKey An execution output key.
	 * @return The node connected to that port.
	 */
	public Optional<Node> executionTarget(Node node, String portKey) {
		return traversal.executionTarget(node, portKey, ctx);
	}

	/**
	 * Traverses from the node connected to an execution output, emitting into the shared context.
	 *
	 * @param node    The node.
	 * @param portKey An execution output key.
	 * @return {@code true} if a successor was connected.
	 */
	public boolean traverseFrom(Node node, String portKey) {
		Optional<Node> target = executionTarget(node, portKey);
		target.ifPresent(t -> traversal.traverse(t, ctx));
		return target.isPresent();
	}
}
