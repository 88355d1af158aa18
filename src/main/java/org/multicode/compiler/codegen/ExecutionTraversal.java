package org.multicode.compiler.codegen;

import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Walks execution edges from a node, dispatching every visited node to its generator.
 * <p>
 * A node is visited at most once per context. Reaching an already visited node ends the walk
 * silently, which turns cycles in the execution flow into bounded output.
 */
public final class ExecutionTraversal {

	private static final Logger LOG = LoggerFactory.getLogger(ExecutionTraversal.class);

	/** The port key followed after an ordinary statement. */
	public static final String EXEC_OUT = "exec-out";

	static final String NODE_BEGIN_MARKER = "// multicode:node-begin ";
	static final String NODE_END_MARKER = "// multicode:node-end ";

	private final NodeGeneratorRegistry registry;
	private final ExpressionResolver resolver;

	public ExecutionTraversal(NodeGeneratorRegistry registry) {
		this.registry = registry;
		this.resolver = new ExpressionResolver(registry);
	}

	/**
	 * @param ctx A context.
	 * @return Helpers bound to the context.
	 */
	public GeneratorHelpers helpers(CodeGenContext ctx) {
		return new GeneratorHelpers(this, resolver, ctx);
	}

	/**
	 * Generates code for a node and its execution successors.
	 *
	 * @param start The first node.
	 * @param ctx   The context to emit into.
	 */
	public void traverse(Node start, CodeGenContext ctx) {
		GeneratorHelpers helpers = helpers(ctx);
		Node current = start;
		while (current != null) {
			if (!ctx.markVisited(current.id())) {
				LOG.debug("Node {} already visited, truncating execution flow", current.id());
				return;
			}
			String next = visit(current, ctx, helpers);
			current = next == null ? null : executionTarget(current, next, ctx).orElse(null);
		}
	}

	/**
	 * Emits one node and returns the execution port to continue with.
	 */
	private String visit(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
		int before = ctx.lineCount();
		Optional<INodeGenerator> generator = registry.get(node.type());
		if (generator.isEmpty()) {
			ctx.emit("// Unsupported node type: " + node.type());
			ctx.recordSourceMapping(node.id(), before + 1, ctx.lineCount());
			return null;
		}

		if (ctx.options().includeComments() && !node.label().isBlank()) {
			String typeLabel = NodeTypes.defaultLabel(node.type());
			if (!node.label().equals(typeLabel)) {
				ctx.emit("// " + typeLabel + ": " + node.label());
			}
		}
		boolean markers = ctx.options().includeSourceMarkers();
		if (markers) ctx.emit(NODE_BEGIN_MARKER + node.id());

		NodeGenerationResult result = generator.get().generate(node, ctx, helpers);

		if (markers) ctx.emit(NODE_END_MARKER + node.id());

		int after = ctx.lineCount();
		if (after > before) {
			ctx.recordSourceMapping(node.id(), before + 1, after);
		} else {
			ctx.recordSourceMapping(node.id(), before, before);
		}

		if (result.customExecutionHandling()) return result.continuationPort();
		return result.followExecutionFlow() ? EXEC_OUT : null;
	}

	/**
	 * Finds the node connected to an execution output of a node.
	 *
	 * @param node    The node.
	 * @param portKey The execution output key.
	 * @param ctx     The context whose graph is searched.
	 * @return The target node.
	 */
	public Optional<Node> executionTarget(Node node, String portKey, CodeGenContext ctx) {
		return ctx.graph().edges().stream()
				.filter(e -> e.isExecution()
						&& node.id().equals(e.sourceNode())
						&& Port.matchesKey(e.sourcePort(), portKey))
				.findFirst()
				.flatMap(e -> ctx.graph().findNode(e.targetNode()));
	}
}
