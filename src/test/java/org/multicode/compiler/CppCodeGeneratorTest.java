package org.multicode.compiler;

import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.GenerationResult;
import org.multicode.compiler.api.PreflightResult;
import org.multicode.compiler.api.SourceMapEntry;
import org.multicode.compiler.api.TargetLanguage;
import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.NodeGeneratorRegistry;
import org.multicode.compiler.diagnostics.CodeGenErrorCode;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.compiler.diagnostics.Diagnostic;
import org.multicode.graph.Graph;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeFactory;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.SubGraph;
import org.multicode.testutils.GraphBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.multicode.testutils.GraphBuilder.BARE;
import static org.multicode.testutils.GraphBuilder.withInput;
import static org.multicode.testutils.GraphBuilder.withLabel;

public class CppCodeGeneratorTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final CppCodeGenerator generator = new CppCodeGenerator(NodeGeneratorRegistry.initializeWithDefaults(), FIXED);

    private static Node print(String id, String text) {
        return withInput(NodeFactory.create(NodeTypes.PRINT, id), "string", text);
    }

    @Test
    @Tag("unit")
    void preflightReportsMissingStartNode() {
        Graph graph = new GraphBuilder("g").node(print("p", "x")).build();

        PreflightResult result = generator.canGenerate(graph);

        assertFalse(result.canGenerate());
        assertThat(result.errors()).extracting(Diagnostic::code).containsExactly(CodeGenErrorCode.NO_START_NODE);
    }

    @Test
    @Tag("unit")
    void preflightReportsSecondStartNode() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "s1")
                .node(NodeTypes.START, "s2")
                .node(NodeTypes.START, "s3")
                .build();

        PreflightResult result = generator.canGenerate(graph);

        assertFalse(result.canGenerate());
        assertEquals(1, result.errors().size());
        assertEquals(CodeGenErrorCode.MULTIPLE_START_NODES, result.errors().get(0).code());
        assertEquals("s2", result.errors().get(0).nodeId());
    }

    @Test
    @Tag("unit")
    void preflightReportsUnknownNodeTypesInGraphAndFunctions() {
        Node mystery = new Node("m", "Mystery", "", null, List.of(), List.of(), null, null);
        Node inBody = new Node("b", "AlsoMystery", "", null, List.of(), List.of(), null, null);
        GraphFunction function = new GraphFunction("f", "F", null, List.of(), new SubGraph(List.of(inBody), List.of()));
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(mystery)
                .function(function)
                .build();

        PreflightResult result = generator.canGenerate(graph);

        assertThat(result.errors())
                .extracting(Diagnostic::code, Diagnostic::nodeId)
                .containsExactly(
                        tuple(CodeGenErrorCode.UNKNOWN_NODE_TYPE, "m"),
                        tuple(CodeGenErrorCode.UNKNOWN_NODE_TYPE, "b"));
    }

    @Test
    @Tag("unit")
    void failedPreflightYieldsEmptyCode() {
        GenerationResult result = generator.generate(new GraphBuilder("g").build());

        assertFalse(result.success());
        assertEquals("", result.code());
        assertThat(result.errors()).hasSize(1);
        assertThat(result.sourceMap()).isEmpty();
    }

    @Test
    @Tag("unit")
    void startOnlyGraphProducesMinimalScaffold() {
        Graph graph = new GraphBuilder("Empty").node(NodeTypes.START, "start").build();

        GenerationResult result = generator.generate(graph, CodeGenOptions.defaults());

        String expected = """
                // Generated by MultiCode
                // Graph: Empty
                // Date: 2024-01-01T00:00:00Z

                #include <iostream>
                #include <string>
                #include <vector>

                int main() {
                    return 0;
                }
                """;
        assertTrue(result.success());
        assertEquals(expected, result.code());
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.sourceMap()).containsExactly(new SourceMapEntry("start", 9, 9));
        assertEquals(1, result.stats().nodesProcessed());
    }

    @Test
    @Tag("unit")
    void disconnectedPrintIsReportedAndNotEmitted() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("print", "Hello"))
                .build();

        GenerationResult result = generator.generate(graph);

        assertTrue(result.success());
        assertThat(result.warnings())
                .extracting(Diagnostic::code, Diagnostic::nodeId)
                .containsExactly(tuple(CodeGenWarningCode.UNUSED_NODE, "print"));
        assertThat(result.code()).doesNotContain("Hello");
    }

    @Test
    @Tag("unit")
    void connectedPrintIsEmittedAndMapped() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("print", "Hello"))
                .exec("start", "print")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertEquals("std::cout << \"Hello\" << std::endl;\n", result.code());
        assertThat(result.warnings()).isEmpty();
        assertThat(result.sourceMap()).containsExactly(
                new SourceMapEntry("start", 1, 1),
                new SourceMapEntry("print", 1, 1));
    }

    @Test
    @Tag("unit")
    void generationIsDeterministicWithoutHeaders() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(NodeTypes.FOR_LOOP, "loop")
                .node(print("print", "tick"))
                .exec("start", "loop")
                .exec("loop", "loop-body", "print")
                .build();
        CodeGenOptions options = CodeGenOptions.defaults().withIncludeHeaders(false);

        GenerationResult first = new CppCodeGenerator().generate(graph, options);
        GenerationResult second = new CppCodeGenerator().generate(graph, options);

        assertEquals(first.code(), second.code());
        assertEquals(first.sourceMap(), second.sourceMap());
    }

    @Test
    @Tag("unit")
    void pureNodesAreNeitherMappedNorReportedAsUnused() {
        Node add = withInput(withInput(NodeFactory.create(NodeTypes.ADD, "add"), "a", 2), "b", 3);
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(add)
                .node(NodeTypes.PRINT, "print")
                .node(NodeTypes.COMMENT, "note")
                .exec("start", "print")
                .data("add", "result", "print", "string")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertEquals("std::cout << (2 + 3) << std::endl;\n", result.code());
        assertThat(result.warnings()).isEmpty();
        assertThat(result.sourceMap()).extracting(SourceMapEntry::nodeId).containsExactly("start", "print");
    }

    @Test
    @Tag("unit")
    void everyUnreachableNodeIsReportedOnce() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("a", "A"))
                .node(print("b", "B"))
                .node(NodeTypes.MULTIPLY, "mul")
                .exec("a", "b")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertThat(result.warnings())
                .filteredOn(d -> d.code() == CodeGenWarningCode.UNUSED_NODE)
                .extracting(Diagnostic::nodeId)
                .containsExactly("a", "b", "mul");
    }

    @Test
    @Tag("unit")
    void unreachableExecutionNodeReadThroughDataEdgeIsStillReported() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(NodeTypes.PRINT, "print")
                .node(NodeTypes.INPUT, "in1")
                .exec("start", "print")
                .data("in1", "value", "print", "string")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertThat(result.warnings())
                .filteredOn(d -> d.code() == CodeGenWarningCode.UNUSED_NODE)
                .extracting(Diagnostic::nodeId)
                .containsExactly("in1");
    }

    @Test
    @Tag("unit")
    void executionCycleIsTruncatedSilently() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("p1", "A"))
                .node(print("p2", "B"))
                .exec("start", "p1")
                .exec("p1", "p2")
                .exec("p2", "p1")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertTrue(result.success());
        assertEquals("""
                std::cout << "A" << std::endl;
                std::cout << "B" << std::endl;
                """, result.code());
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @Tag("unit")
    void renamedNodesGetLabelComment() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(withLabel(print("print", "hi"), "Greet"))
                .exec("start", "print")
                .build();

        GenerationResult result = generator.generate(graph, BARE.withIncludeComments(true));

        assertEquals("""
                // Print String: Greet
                std::cout << "hi" << std::endl;
                """, result.code());
        assertThat(result.sourceMap()).contains(new SourceMapEntry("print", 1, 2));
    }

    @Test
    @Tag("unit")
    void sourceMarkersWrapEveryVisitedNode() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("print", "hi"))
                .exec("start", "print")
                .build();

        GenerationResult result = generator.generate(graph, BARE.withIncludeSourceMarkers(true));

        assertEquals("""
                // multicode:node-begin start
                // multicode:node-end start
                // multicode:node-begin print
                std::cout << "hi" << std::endl;
                // multicode:node-end print
                """, result.code());
        assertThat(result.sourceMap()).containsExactly(
                new SourceMapEntry("start", 1, 2),
                new SourceMapEntry("print", 3, 5));
    }

    @Test
    @Tag("unit")
    void sourceMapUsesFinalLineNumbers() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("print", "hi"))
                .exec("start", "print")
                .build();

        GenerationResult result = generator.generate(graph, CodeGenOptions.defaults());

        List<String> lines = result.code().lines().toList();
        SourceMapEntry entry = result.sourceMap().stream().filter(e -> e.nodeId().equals("print")).findFirst().orElseThrow();
        assertEquals("    std::cout << \"hi\" << std::endl;", lines.get(entry.startLine() - 1));
    }

    @Test
    @Tag("unit")
    void incompatibleDataEdgeIsHinted() {
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(NodeTypes.INPUT, "in")
                .node(NodeTypes.BRANCH, "branch")
                .exec("start", "in")
                .exec("in", "branch")
                .data("in", "value", "branch", "condition")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertTrue(result.success());
        assertThat(result.warnings())
                .extracting(Diagnostic::code)
                .contains(CodeGenWarningCode.TYPE_MISMATCH);
    }

    @Test
    @Tag("unit")
    void registeredGeneratorReplacesBuiltIn() {
        CppCodeGenerator custom = new CppCodeGenerator(NodeGeneratorRegistry.initializeWithDefaults(), FIXED);
        custom.registerGenerator(new AbstractNodeGenerator(NodeTypes.PRINT) {
            @Override
            public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
                ctx.emit("printf(\"custom\\n\");");
                return NodeGenerationResult.follow();
            }
        });
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(print("print", "hi"))
                .exec("start", "print")
                .build();

        GenerationResult result = custom.generate(graph, BARE);

        assertEquals("printf(\"custom\\n\");\n", result.code());
    }

    @Test
    @Tag("unit")
    void reportsLanguageAndSupportedTypes() {
        assertEquals(TargetLanguage.CPP, generator.getLanguage());
        assertThat(generator.getSupportedNodeTypes())
                .contains(NodeTypes.START, NodeTypes.BRANCH, NodeTypes.ADD, NodeTypes.CALL_USER_FUNCTION)
                .doesNotHaveDuplicates();
    }

    @Test
    @Tag("unit")
    void linesOfCodeSkipCommentsAndBlankLines() {
        Graph graph = new GraphBuilder("Empty").node(NodeTypes.START, "start").build();

        GenerationResult result = generator.generate(graph, CodeGenOptions.defaults());

        // 3 includes + int main() + return 0; + }
        assertEquals(6, result.stats().linesOfCode());
    }
}
