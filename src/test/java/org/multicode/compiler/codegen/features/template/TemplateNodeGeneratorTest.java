package org.multicode.compiler.codegen.features.template;

import org.multicode.compiler.CppCodeGenerator;
import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.GenerationResult;
import org.multicode.graph.Graph;
import org.multicode.graph.Node;
import org.multicode.graph.NodeFactory;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;
import org.multicode.graph.PortDataType;
import org.multicode.testutils.GraphBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.multicode.testutils.GraphBuilder.BARE;
import static org.multicode.testutils.GraphBuilder.withInput;
import static org.multicode.testutils.GraphBuilder.withProperty;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class TemplateNodeGeneratorTest {

    private static final CodeGenOptions NO_WRAPPER = CodeGenOptions.defaults()
            .withGenerateEntryWrapper(false)
            .withIncludeComments(false);

    @Mock
    private NodeDefinitionLookup lookup;

    private static NodeDefinition definition(String type, String label, CodegenTemplate template,
                                             PropertyDefinition... properties) {
        return new NodeDefinition(type, label, "Package", null, List.of(), List.of(),
                template != null ? Map.of("cpp", template) : Map.of(), List.of(properties));
    }

    /** A statement node with an execution pass-through and one float input {@code x}. */
    private static Node statementNode(String type, String id) {
        return new Node(id, type, type, null,
                List.of(Port.input(id + "-exec-in", PortDataType.EXECUTION),
                        new Port(id + "-x", "X", PortDataType.FLOAT, null, null, null)),
                List.of(Port.output(id + "-exec-out", PortDataType.EXECUTION)),
                null, null);
    }

    private static Graph graphWith(Node packageNode) {
        return new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(packageNode)
                .exec("start", packageNode.id())
                .build();
    }

    @Test
    void statementTemplate_substitutesInputsAndOutputsAndAddsIncludes() {
        when(lookup.find("Sqrt")).thenReturn(Optional.of(definition("Sqrt", "Square Root",
                CodegenTemplate.of("double {{output.root}} = std::sqrt({{input.x}});", "<cmath>"))));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Sqrt"));

        GenerationResult result = generator.generate(graphWith(withInput(statementNode("Sqrt", "n1"), "x", 16)), NO_WRAPPER);

        assertThat(result.code())
                .contains("#include <cmath>\n")
                .endsWith("double root_n1 = std::sqrt(16);\n");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void missingInputAndPropertyAreMarkedInline() {
        when(lookup.find("Log")).thenReturn(Optional.of(definition("Log", "Log",
                CodegenTemplate.of("log({{input.x}}, {{prop.level}});"))));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Log"));

        GenerationResult result = generator.generate(graphWith(statementNode("Log", "n1")), BARE);

        assertEquals("log(/* missing input */, /* missing prop */);\n", result.code());
    }

    @Test
    void dataInputKeyIsNotConfusedWithExecutionInput() {
        when(lookup.find("Log")).thenReturn(Optional.of(definition("Log", "Log",
                CodegenTemplate.of("log({{input.in}});"))));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Log"));
        Node log = new Node("n1", "Log", "Log", null,
                List.of(Port.input("n1-exec-in", PortDataType.EXECUTION),
                        new Port("n1-in", "In", PortDataType.INT32, null, null, 5)),
                List.of(Port.output("n1-exec-out", PortDataType.EXECUTION)),
                null, null);

        GenerationResult result = generator.generate(graphWith(log), BARE);

        assertEquals("log(5);\n", result.code());
    }

    @Test
    void propertiesFallBackToDeclaredDefaults() {
        when(lookup.find("Delay")).thenReturn(Optional.of(definition("Delay", "Delay",
                CodegenTemplate.of("delay({{prop.ms}}); // {{node.label}}"),
                new PropertyDefinition("ms", "Milliseconds", "number", 100))));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Delay"));

        GenerationResult defaults = generator.generate(graphWith(statementNode("Delay", "d1")), BARE);
        GenerationResult explicit = generator.generate(
                graphWith(withProperty(statementNode("Delay", "d1"), "ms", 250)), BARE);

        assertEquals("delay(100); // Delay\n", defaults.code());
        assertEquals("delay(250); // Delay\n", explicit.code());
    }

    @Test
    void beforeAndAfterWrapMultiLineTemplate() {
        CodegenTemplate template = new CodegenTemplate("step1();\nstep2();", List.of(), "begin();", "end();");
        when(lookup.find("Steps")).thenReturn(Optional.of(definition("Steps", "Steps", template)));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Steps"));

        GenerationResult result = generator.generate(graphWith(statementNode("Steps", "s")), BARE);

        assertEquals("""
                begin();
                step1();
                step2();
                end();
                """, result.code());
    }

    @Test
    void pureTemplate_isInlinedAndStillContributesIncludes() {
        when(lookup.find("Pi")).thenReturn(Optional.of(definition("Pi", "Pi", CodegenTemplate.of("M_PI", "<cmath>"))));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Pi"));
        Node pi = new Node("pi", "Pi", "Pi", null, List.of(),
                List.of(Port.output("pi-value", PortDataType.DOUBLE)), null, null);
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(pi)
                .node(NodeTypes.PRINT, "print")
                .exec("start", "print")
                .data("pi", "value", "print", "string")
                .build();

        GenerationResult result = generator.generate(graph, NO_WRAPPER);

        assertThat(result.code())
                .contains("#include <cmath>\n")
                .endsWith("std::cout << M_PI << std::endl;\n");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void includesDoNotLeakIntoLaterGenerations() {
        when(lookup.find("Sqrt")).thenReturn(Optional.of(definition("Sqrt", "Square Root",
                CodegenTemplate.of("std::sqrt({{input.x}});", "<cmath>"))));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Sqrt"));

        GenerationResult first = generator.generate(graphWith(statementNode("Sqrt", "n1")), NO_WRAPPER);
        GenerationResult second = generator.generate(new GraphBuilder("g").node(NodeTypes.START, "start").build(), NO_WRAPPER);

        assertThat(first.code()).contains("#include <cmath>");
        assertThat(second.code()).doesNotContain("<cmath>");
    }

    @Test
    void nodeWithoutTemplate_emitsNothingAndContinues() {
        when(lookup.find("Blank")).thenReturn(Optional.of(definition("Blank", "Blank", null)));
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Blank"));
        Node print = withInput(NodeFactory.create(NodeTypes.PRINT, "print"), "string", "after");
        Graph graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(statementNode("Blank", "b"))
                .node(print)
                .exec("start", "b")
                .exec("b", "print")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertEquals("std::cout << \"after\" << std::endl;\n", result.code());
        verify(lookup, atLeastOnce()).find("Blank");
    }

    @Test
    void definitionsAreResolvedAtGenerationTime() {
        CppCodeGenerator generator = CppCodeGenerator.withPackages(lookup, List.of("Late"));
        when(lookup.find("Late")).thenReturn(Optional.of(definition("Late", "Late", CodegenTemplate.of("late();"))));

        GenerationResult result = generator.generate(graphWith(statementNode("Late", "l")), BARE);

        assertEquals("late();\n", result.code());
        assertThat(generator.getSupportedNodeTypes()).contains("Late");
    }

    @Test
    void outputVariable_usesLastEightCharactersOfCleanedNodeId() {
        assertEquals("result_abcd_123", TemplateNodeGenerator.outputVariable("node-abcd-123", "result"));
        assertEquals("out_n1", TemplateNodeGenerator.outputVariable("n1", "out"));
    }
}
