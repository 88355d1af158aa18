package org.multicode.compiler.codegen;

import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.SourceMapEntry;
import org.multicode.compiler.codegen.features.functions.FunctionSignatures;
import org.multicode.compiler.diagnostics.DiagnosticsEngine;
import org.multicode.graph.FunctionParameter;
import org.multicode.graph.Graph;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the C++ definition of a user-defined function from its sub-graph.
 * <p>
 * Each body is traversed in a fresh context, so the variable table and the visited set never
 * leak between a function and its caller. Diagnostics of the body are merged into the caller's.
 */
public final class FunctionSynthesizer {

	private final ExecutionTraversal traversal;

	public FunctionSynthesizer(ExecutionTraversal traversal) {
		this.traversal = traversal;
	}

	/**
	 * A generated function definition.
	 *
	 * @param functionId     The function.
	 * @param lines          The definition lines, without a trailing separator.
	 * @param sourceMap      Entries relative to the first line of the block.
	 * @param nodesProcessed Number of visited body nodes, the entry node included.
	 */
	public record FunctionBlock(String functionId, List<String> lines, List<SourceMapEntry> sourceMap, int nodesProcessed) {
		public FunctionBlock {
			lines = List.copyOf(lines);
			sourceMap = List.copyOf(sourceMap);
		}
	}

	/**
	 * Generates one function definition.
	 *
	 * @param function    The function.
	 * @param program     The graph being compiled.
	 * @param options     The generation options.
	 * @param headers     The header requirements of the generation call.
	 * @param diagnostics The caller's diagnostics, receiving the body's errors and warnings.
	 * @return The generated block.
	 */
	public FunctionBlock synthesize(GraphFunction function, Graph program, CodeGenOptions options,
									HeaderRequirements headers, DiagnosticsEngine diagnostics) {
		CodeGenContext ctx = CodeGenContext.forFunction(program, function, options, headers);

		if (options.includeComments() && function.description() != null && !function.description().isBlank()) {
			for (String line : function.description().strip().split("\\R")) {
				ctx.emit("// " + line.strip());
			}
		}
		if (FunctionSignatures.hasResultType(function)) {
			headers.requireTupleSupport();
			ctx.emit(FunctionSignatures.resultTypeDeclaration(function));
		}

		Optional<Node> entry = function.graph().nodesOfType(NodeTypes.FUNCTION_ENTRY).stream().findFirst();
		String ownerId = entry.map(Node::id).orElse(function.id());
		for (FunctionParameter parameter : function.inputs()) {
			ctx.variables().bindName(FunctionSignatures.parameterVariableId(parameter),
					Identifiers.toIdentifier(parameter.name()), parameter.name(),
					CppTypes.cppType(parameter.dataType()), ownerId);
		}

		ctx.emit(signature(function, ctx));
		entry.ifPresent(e -> {
			ctx.markVisited(e.id());
			ctx.recordSourceMapping(e.id(), ctx.lineCount(), ctx.lineCount());
		});

		ctx.setIndentLevel(1);
		int bodyStart = ctx.lineCount();
		entry.flatMap(e -> traversal.executionTarget(e, ExecutionTraversal.EXEC_OUT, ctx))
				.ifPresent(first -> traversal.traverse(first, ctx));
		if (ctx.lineCount() == bodyStart || (!function.outputs().isEmpty() && !endsWithReturn(ctx))) {
			ctx.emit(FunctionSignatures.defaultReturn(function));
		}
		ctx.setIndentLevel(0);
		ctx.emit("}");

		diagnostics.mergeFrom(ctx.diagnostics());
		return new FunctionBlock(function.id(), ctx.lines(), ctx.sourceMap(), ctx.visited().size());
	}

	private static String signature(GraphFunction function, CodeGenContext ctx) {
		String parameters = function.inputs().stream()
				.map(p -> CppTypes.cppType(p.dataType()) + " "
						+ ctx.variables().lookup(FunctionSignatures.parameterVariableId(p)).map(VariableBinding::codeName).orElseThrow())
				.collect(Collectors.joining(", "));
		return FunctionSignatures.returnType(function) + " " + FunctionSignatures.functionName(function)
				+ "(" + parameters + ") {";
	}

	private static boolean endsWithReturn(CodeGenContext ctx) {
		List<String> lines = ctx.lines();
		for (int i = lines.size() - 1; i >= 0; i--) {
			String line = lines.get(i).trim();
			if (line.isEmpty() || line.startsWith("//")) continue;
			return line.startsWith("return");
		}
		return false;
	}
}
