package org.multicode.compiler.codegen;

import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.SourceMapEntry;
import org.multicode.compiler.diagnostics.CodeGenErrorCode;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.compiler.diagnostics.DiagnosticsEngine;
import org.multicode.graph.Graph;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.NodeGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable context of one traversal scope: the main graph or a single function body.
 * Provides line emission, indentation, the variable table, visit bookkeeping and diagnostics.
 * <p>
 * Source-map entries are recorded relative to this context's own line buffer (1-based); the
 * output composer moves them to their final position.
 */
public final class CodeGenContext {

	private final NodeGraph graph;
	private final Graph program;
	private final GraphFunction currentFunction;
	private final CodeGenOptions options;
	private final DiagnosticsEngine diagnostics;
	private final HeaderRequirements headers;
	private final VariableBindingTable variables = new VariableBindingTable();
	private final Set<String> visited = new LinkedHashSet<>();
	private final Set<String> consumed = new HashSet<>();
	private final Set<String> resolving = new HashSet<>();
	private final Set<String> reportedOnce = new HashSet<>();
	private final List<String> lines = new ArrayList<>();
	private final List<SourceMapEntry> sourceMap = new ArrayList<>();
	private int indentLevel;

	private CodeGenContext(NodeGraph graph, Graph program, GraphFunction currentFunction, CodeGenOptions options,
						   DiagnosticsEngine diagnostics, HeaderRequirements headers) {
		this.graph = graph;
		this.program = program;
		this.currentFunction = currentFunction;
		this.options = options;
		this.diagnostics = diagnostics;
		this.headers = headers;
	}

	/**
	 * Creates the context of the main traversal.
	 *
	 * @param program     The graph being compiled.
	 * @param options     The generation options.
	 * @param diagnostics The diagnostics engine of the generation call.
	 * @param headers     The header requirements of the generation call.
	 * @return A fresh context.
	 */
	public static CodeGenContext forProgram(Graph program, CodeGenOptions options,
											DiagnosticsEngine diagnostics, HeaderRequirements headers) {
		return new CodeGenContext(program, program, null, options, diagnostics, headers);
	}

	/**
	 * Creates the context of a function body with its own diagnostics engine, variable table
	 * and visited set.
	 *
	 * @param program  The graph being compiled, used to look up other functions.
	 * @param function The function whose body is generated.
	 * @param options  The generation options.
	 * @param headers  The header requirements of the generation call.
	 * @return A fresh context.
	 */
	public static CodeGenContext forFunction(Graph program, GraphFunction function, CodeGenOptions options,
											 HeaderRequirements headers) {
		return new CodeGenContext(function.graph(), program, function, options, new DiagnosticsEngine(), headers);
	}

	/**
	 * Emits one line at the current indentation. An empty string emits an empty line.
	 *
	 * @param code The line content without indentation.
	 */
	public void emit(String code) {
		lines.add(code.isEmpty() ? "" : indent() + code);
	}

	/**
	 * @return The number of lines emitted so far.
	 */
	public int lineCount() {
		return lines.size();
	}

	/**
	 * @return The emitted lines.
	 */
	public List<String> lines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * @return The whitespace of the current indentation level.
	 */
	public String indent() {
		return " ".repeat(indentLevel * options.indentSize());
	}

	public void pushIndent() {
		indentLevel++;
	}

	public void popIndent() {
		if (indentLevel > 0) indentLevel--;
	}

	public int indentLevel() {
		return indentLevel;
	}

	public void setIndentLevel(int indentLevel) {
		this.indentLevel = Math.max(0, indentLevel);
	}

	/**
	 * Marks a node as visited by the execution traversal.
	 *
	 * @param nodeId The node id.
	 * @return {@code false} if the node was already visited.
	 */
	public boolean markVisited(String nodeId) {
		return visited.add(nodeId);
	}

	public boolean isVisited(String nodeId) {
		return visited.contains(nodeId);
	}

	/**
	 * @return The visited node ids in visit order.
	 */
	public Set<String> visited() {
		return Collections.unmodifiableSet(visited);
	}

	/**
	 * Marks a node whose output was used through a data edge.
	 *
	 * @param nodeId The node id.
	 */
	public void markConsumed(String nodeId) {
		consumed.add(nodeId);
	}

	/**
	 * @param nodeId The node id.
	 * @return {@code true} if the node was visited or its output was consumed.
	 */
	public boolean isResolved(String nodeId) {
		return visited.contains(nodeId) || consumed.contains(nodeId);
	}

	/**
	 * Enters the resolution of a node's output. Guards against cycles of data edges.
	 *
	 * @param nodeId The node id.
	 * @return {@code false} if the node is already being resolved further up the stack.
	 */
	boolean beginResolving(String nodeId) {
		return resolving.add(nodeId);
	}

	void endResolving(String nodeId) {
		resolving.remove(nodeId);
	}

	/**
	 * Records a source-map entry relative to this context's line buffer.
	 *
	 * @param nodeId    The node.
	 * @param startLine First line, 1-based; 0 anchors before the first line.
	 * @param endLine   Last line.
	 */
	public void recordSourceMapping(String nodeId, int startLine, int endLine) {
		sourceMap.add(new SourceMapEntry(nodeId, startLine, Math.max(startLine, endLine)));
	}

	public List<SourceMapEntry> sourceMap() {
		return Collections.unmodifiableList(sourceMap);
	}

	/**
	 * Reports a warning.
	 */
	public void warn(CodeGenWarningCode code, String nodeId, String message) {
		diagnostics.reportWarning(code, nodeId, message);
	}

	/**
	 * Reports a warning at most once per code and node, for checks that run whenever an
	 * expression is resolved.
	 */
	public void warnOnce(CodeGenWarningCode code, String nodeId, String message) {
		if (reportedOnce.add(code.name() + "@" + nodeId)) {
			diagnostics.reportWarning(code, nodeId, message);
		}
	}

	/**
	 * Reports an error.
	 */
	public void error(CodeGenErrorCode code, String nodeId, String message) {
		diagnostics.reportError(code, nodeId, message);
	}

	/**
	 * @return The nodes and edges of this scope.
	 */
	public NodeGraph graph() {
		return graph;
	}

	/**
	 * @return The graph being compiled.
	 */
	public Graph program() {
		return program;
	}

	/**
	 * @return The function whose body is generated, empty for the main traversal.
	 */
	public Optional<GraphFunction> currentFunction() {
		return Optional.ofNullable(currentFunction);
	}

	public CodeGenOptions options() {
		return options;
	}

	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	public HeaderRequirements headers() {
		return headers;
	}

	public VariableBindingTable variables() {
		return variables;
	}
}
