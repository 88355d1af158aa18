package org.multicode.compiler;

import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.GenerationResult;
import org.multicode.compiler.api.GenerationStats;
import org.multicode.compiler.api.ICodeGenerator;
import org.multicode.compiler.api.PreflightResult;
import org.multicode.compiler.api.TargetLanguage;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.ExecutionTraversal;
import org.multicode.compiler.codegen.FunctionSynthesizer;
import org.multicode.compiler.codegen.FunctionSynthesizer.FunctionBlock;
import org.multicode.compiler.codegen.HeaderRequirements;
import org.multicode.compiler.codegen.INodeGenerator;
import org.multicode.compiler.codegen.NodeGeneratorRegistry;
import org.multicode.compiler.codegen.OutputComposer;
import org.multicode.compiler.codegen.OutputComposer.Composition;
import org.multicode.compiler.codegen.features.template.NodeDefinitionLookup;
import org.multicode.compiler.diagnostics.CodeGenErrorCode;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.compiler.diagnostics.DiagnosticsEngine;
import org.multicode.graph.Edge;
import org.multicode.graph.Graph;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeGraph;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles a program graph to C++. Orchestrates preflight, function synthesis, the main
 * execution traversal, the unused-node and port-compatibility passes, and output composition.
 * <p>
 * All per-call state lives in values created inside {@link #generate(Graph, CodeGenOptions)}, so
 * one instance may serve concurrent calls as long as no generator is registered meanwhile.
 */
public class CppCodeGenerator implements ICodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CppCodeGenerator.class);

    private final NodeGeneratorRegistry registry;
    private final Clock clock;

    public CppCodeGenerator() {
        this(NodeGeneratorRegistry.initializeWithDefaults());
    }

    public CppCodeGenerator(NodeGeneratorRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    /**
     * @param registry The node generators.
     * @param clock    Source of the header timestamp.
     */
    public CppCodeGenerator(NodeGeneratorRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Creates a generator that also handles package node types through their templates.
     *
     * @param lookup       Resolves package node definitions.
     * @param packageTypes The package node-type tags.
     * @return The generator.
     */
    public static CppCodeGenerator withPackages(NodeDefinitionLookup lookup, List<String> packageTypes) {
        return new CppCodeGenerator(NodeGeneratorRegistry.initializeWithPackages(lookup, packageTypes));
    }

    /**
     * Registers an additional generator, replacing any generator for the same types.
     */
    public void registerGenerator(INodeGenerator generator) {
        registry.register(generator);
    }

    @Override
    public PreflightResult canGenerate(Graph graph) {
        DiagnosticsEngine preflight = new DiagnosticsEngine();
        List<Node> starts = graph.nodesOfType(NodeTypes.START);
        if (starts.isEmpty()) {
            preflight.reportError(CodeGenErrorCode.NO_START_NODE, null, "Graph has no Start node");
        } else if (starts.size() > 1) {
            preflight.reportError(CodeGenErrorCode.MULTIPLE_START_NODES, starts.get(1).id(),
                    "Graph has " + starts.size() + " Start nodes, exactly one is required");
        }
        checkNodeTypes(graph, preflight);
        for (GraphFunction function : graph.functions()) {
            checkNodeTypes(function.graph(), preflight);
        }
        return PreflightResult.of(preflight.errors());
    }

    @Override
    public GenerationResult generate(Graph graph, CodeGenOptions options) {
        long startNanos = System.nanoTime();

        PreflightResult preflight = canGenerate(graph);
        if (!preflight.canGenerate()) {
            LOG.debug("Preflight failed for graph '{}' with {} error(s)", graph.name(), preflight.errors().size());
            return GenerationResult.preflightFailure(preflight.errors(), elapsedMillis(startNanos));
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        HeaderRequirements headers = new HeaderRequirements();
        ExecutionTraversal traversal = new ExecutionTraversal(registry);

        FunctionSynthesizer synthesizer = new FunctionSynthesizer(traversal);
        List<FunctionBlock> functions = new ArrayList<>();
        for (GraphFunction function : graph.functions()) {
            functions.add(synthesizer.synthesize(function, graph, options, headers, diagnostics));
        }

        CodeGenContext main = CodeGenContext.forProgram(graph, options, diagnostics, headers);
        if (options.generateEntryWrapper()) {
            main.setIndentLevel(1);
        }
        traversal.traverse(graph.nodesOfType(NodeTypes.START).get(0), main);

        reportUnusedNodes(graph, main);
        reportTypeMismatches(graph, diagnostics);

        Composition composition = new OutputComposer(clock).compose(graph, options, functions, main, headers);

        int nodesProcessed = main.visited().size()
                + functions.stream().mapToInt(FunctionBlock::nodesProcessed).sum();
        long elapsed = elapsedMillis(startNanos);
        LOG.debug("Generated {} line(s) of C++ for graph '{}' from {} node(s) in {} ms ({} error(s), {} warning(s))",
                composition.linesOfCode(), graph.name(), nodesProcessed, elapsed,
                diagnostics.errors().size(), diagnostics.warnings().size());

        return new GenerationResult(
                !diagnostics.hasErrors(),
                composition.code(),
                diagnostics.errors(),
                diagnostics.warnings(),
                composition.sourceMap(),
                new GenerationStats(nodesProcessed, composition.linesOfCode(), elapsed));
    }

    @Override
    public List<String> getSupportedNodeTypes() {
        return registry.getSupportedTypes();
    }

    @Override
    public TargetLanguage getLanguage() {
        return TargetLanguage.CPP;
    }

    private void checkNodeTypes(NodeGraph graph, DiagnosticsEngine preflight) {
        for (Node node : graph.nodes()) {
            if (!registry.has(node.type())) {
                preflight.reportError(CodeGenErrorCode.UNKNOWN_NODE_TYPE, node.id(),
                        "Unknown node type: " + node.type());
            }
        }
    }

    private static void reportUnusedNodes(Graph graph, CodeGenContext main) {
        for (Node node : graph.nodes()) {
            if (NodeTypes.COMMENT.equals(node.type()) || main.isVisited(node.id())) continue;
            // Only pure nodes are used through their data outputs alone.
            if (!node.hasExecutionOutput() && main.isResolved(node.id())) continue;
            main.warn(CodeGenWarningCode.UNUSED_NODE, node.id(),
                    "Node '" + displayName(node) + "' is not connected to the execution flow");
        }
    }

    /**
     * Best-effort port-compatibility hints for the data edges of the graph and its functions.
     */
    private static void reportTypeMismatches(Graph graph, DiagnosticsEngine diagnostics) {
        checkEdges(graph, diagnostics);
        for (GraphFunction function : graph.functions()) {
            checkEdges(function.graph(), diagnostics);
        }
    }

    private static void checkEdges(NodeGraph graph, DiagnosticsEngine diagnostics) {
        for (Edge edge : graph.edges()) {
            if (edge.isExecution()) continue;
            Optional<Port> source = graph.findNode(edge.sourceNode()).flatMap(n -> findPort(n.outputs(), edge.sourcePort()));
            Optional<Port> target = graph.findNode(edge.targetNode()).flatMap(n -> findPort(n.inputs(), edge.targetPort()));
            if (source.isEmpty() || target.isEmpty()) continue;
            if (!source.get().dataType().isCompatibleWith(target.get().dataType())) {
                diagnostics.reportWarning(CodeGenWarningCode.TYPE_MISMATCH, edge.targetNode(),
                        "Cannot connect " + source.get().dataType().wireName() + " to "
                                + target.get().dataType().wireName() + " (edge " + edge.id() + ")");
            }
        }
    }

    private static Optional<Port> findPort(List<Port> ports, String portId) {
        return ports.stream().filter(p -> p.id().equals(portId)).findFirst()
                .or(() -> ports.stream().filter(p -> Port.matchesKey(portId, p.id()) || p.matchesKey(portId)).findFirst());
    }

    private static String displayName(Node node) {
        return node.label().isBlank() ? node.type() : node.label();
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
