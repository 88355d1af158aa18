package org.multicode.compiler.codegen;

import org.multicode.graph.Edge;
import org.multicode.graph.Node;
import org.multicode.graph.Port;
import org.multicode.graph.PortDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves the expression feeding an input port, recursing through data edges into the
 * output expressions of source nodes and falling back to literal port values.
 */
public final class ExpressionResolver {

	private static final Logger LOG = LoggerFactory.getLogger(ExpressionResolver.class);

	private final NodeGeneratorRegistry registry;

	public ExpressionResolver(NodeGeneratorRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Resolves an input port of a node.
	 *
	 * @param node    The node owning the port.
	 * @param portKey The port key, e.g. {@code "condition"}.
	 * @param helpers The helpers of the current context.
	 * @return The expression of the connected source, else the port's value or default as a
	 *         literal, else empty.
	 */
	public Optional<String> resolveInput(Node node, String portKey, GeneratorHelpers helpers) {
		Optional<Port> port = node.findDataInput(portKey);
		if (port.isEmpty()) return Optional.empty();
		CodeGenContext ctx = helpers.context();

		Optional<Edge> incoming = ctx.graph().edges().stream()
				.filter(e -> !e.isExecution())
				.filter(e -> node.id().equals(e.targetNode()))
				.filter(e -> port.get().id().equals(e.targetPort()) || Port.matchesKey(e.targetPort(), portKey))
				.findFirst();
		if (incoming.isPresent()) {
			Optional<Node> source = ctx.graph().findNode(incoming.get().sourceNode());
			if (source.isPresent()) {
				ctx.markConsumed(source.get().id());
				return Optional.of(resolveOutput(source.get(), incoming.get().sourcePort(), helpers));
			}
			LOG.debug("Data edge {} references missing node {}", incoming.get().id(), incoming.get().sourceNode());
		}

		Port p = port.get();
		if (p.value() != null) return Optional.of(formatLiteral(p.value(), p.dataType()));
		if (p.defaultValue() != null) return Optional.of(formatLiteral(p.defaultValue(), p.dataType()));
		return Optional.empty();
	}

	/**
	 * Produces the expression of a node's output port via its generator.
	 *
	 * @param node    The source node.
	 * @param portId  The output port id.
	 * @param helpers The helpers of the current context.
	 * @return The expression, or {@code "0"} if the node type has no generator or yields no value.
	 */
	public String resolveOutput(Node node, String portId, GeneratorHelpers helpers) {
		Optional<INodeGenerator> generator = registry.get(node.type());
		if (generator.isEmpty()) return "0";
		CodeGenContext ctx = helpers.context();
		if (!ctx.beginResolving(node.id())) {
			LOG.debug("Data cycle through node {}, using 0", node.id());
			return "0";
		}
		try {
			return generator.get().outputExpression(node, portId, ctx, helpers).orElse("0");
		} finally {
			ctx.endResolving(node.id());
		}
	}

	/**
	 * Renders a port value as a C++ literal. String-typed values are quoted with {@code "} and
	 * {@code \} escaped; integral numbers print without a fractional part.
	 *
	 * @param value The raw value.
	 * @param type  The port type.
	 * @return The literal.
	 */
	public static String formatLiteral(Object value, PortDataType type) {
		if (type == PortDataType.STRING) {
			String text = String.valueOf(value).replace("\\", "\\\\").replace("\"", "\\\"");
			return "\"" + text + "\"";
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
				return Long.toString((long) d);
			}
			return Double.toString(d);
		}
		return String.valueOf(value);
	}
}
