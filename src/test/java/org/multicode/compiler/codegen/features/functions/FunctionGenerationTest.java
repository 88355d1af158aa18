package org.multicode.compiler.codegen.features.functions;

import org.multicode.compiler.CppCodeGenerator;
import org.multicode.compiler.api.CodeGenOptions;
import org.multicode.compiler.api.GenerationResult;
import org.multicode.compiler.api.SourceMapEntry;
import org.multicode.compiler.diagnostics.CodeGenErrorCode;
import org.multicode.compiler.diagnostics.Diagnostic;
import org.multicode.graph.FunctionParameter;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeFactory;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;
import org.multicode.graph.PortDataType;
import org.multicode.graph.SubGraph;
import org.multicode.testutils.GraphBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.multicode.testutils.GraphBuilder.BARE;
import static org.multicode.testutils.GraphBuilder.withInput;
import static org.multicode.testutils.GraphBuilder.withProperty;

public class FunctionGenerationTest {

    private final CppCodeGenerator generator = new CppCodeGenerator();

    private static final List<FunctionParameter> SUM_PARAMETERS = List.of(
            FunctionParameter.input("a", "A", PortDataType.INT32),
            FunctionParameter.input("b", "B", PortDataType.INT32),
            FunctionParameter.output("result", "Result", PortDataType.INT32));

    private static GraphFunction sumFunction() {
        GraphFunction signature = new GraphFunction("sum", "Sum", null, SUM_PARAMETERS, null);
        SubGraph body = new GraphBuilder("Sum")
                .node(NodeFactory.functionEntry(signature, "entry"))
                .node(NodeFactory.functionReturn(signature, "ret"))
                .node(NodeTypes.ADD, "add")
                .exec("entry", "ret")
                .data("entry", "a", "add", "a")
                .data("entry", "b", "add", "b")
                .data("add", "result", "ret", "result")
                .buildBody();
        return new GraphFunction("sum", "Sum", null, SUM_PARAMETERS, body);
    }

    @Test
    @Tag("unit")
    void functionWithSingleOutputReturnsItsValue() {
        GraphFunction sum = sumFunction();
        Node call = withInput(withInput(NodeFactory.callFunction(sum, "call"), "a", 2), "b", 3);
        var graph = new GraphBuilder("Calc")
                .node(NodeTypes.START, "start")
                .node(call)
                .node(NodeTypes.PRINT, "print")
                .exec("start", "call")
                .exec("call", "print")
                .data("call", "result", "print", "string")
                .function(sum)
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertTrue(result.success(), () -> result.errors().toString());
        assertEquals("""
                int Sum(int a, int b) {
                    return (a + b);
                }

                auto result_call = Sum(2, 3);
                std::cout << result_call << std::endl;
                """, result.code());
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @Tag("unit")
    void functionSourceMapIsMergedIntoFileLines() {
        var graph = new GraphBuilder("Calc")
                .node(NodeTypes.START, "start")
                .function(sumFunction())
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertThat(result.sourceMap()).contains(
                new SourceMapEntry("entry", 1, 1),
                new SourceMapEntry("ret", 2, 2));
        assertThat(result.sourceMap()).extracting(SourceMapEntry::nodeId).doesNotContain("add");
        assertEquals(3, result.stats().nodesProcessed());
    }

    @Test
    @Tag("unit")
    void singleOutputNeedsNoResultTypeOrTupleInclude() {
        var graph = new GraphBuilder("Calc")
                .node(NodeTypes.START, "start")
                .function(sumFunction())
                .build();

        GenerationResult result = generator.generate(graph, CodeGenOptions.defaults());

        assertTrue(result.success(), () -> result.errors().toString());
        assertThat(result.code())
                .contains("#include <iostream>", "int Sum(int a, int b) {")
                .doesNotContain("#include <tuple>")
                .doesNotContain("using ")
                .doesNotContain("SumResult");
    }

    @Test
    @Tag("unit")
    void returnInsideVoidFunctionReturnsNothing() {
        GraphFunction signature = new GraphFunction("greet", "Greet", null, List.of(), null);
        SubGraph body = new GraphBuilder("Greet")
                .node(NodeFactory.functionEntry(signature, "entry"))
                .node(withInput(NodeFactory.create(NodeTypes.PRINT, "hello"), "string", "hi"))
                .node(NodeTypes.RETURN, "done")
                .exec("entry", "hello")
                .exec("hello", "done")
                .buildBody();
        var graph = new GraphBuilder("App")
                .node(NodeTypes.START, "start")
                .function(new GraphFunction("greet", "Greet", null, List.of(), body))
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertTrue(result.success(), () -> result.errors().toString());
        assertEquals("""
                void Greet() {
                    std::cout << "hi" << std::endl;
                    return;
                }
                """, result.code().substring(0, result.code().indexOf("}\n") + 2));
    }

    @Test
    @Tag("unit")
    void multipleOutputsUseTupleResultType() {
        List<FunctionParameter> parameters = List.of(
                FunctionParameter.input("x", "X", PortDataType.INT32),
                FunctionParameter.input("y", "Y", PortDataType.INT32),
                FunctionParameter.output("q", "Q", PortDataType.INT32),
                FunctionParameter.output("r", "R", PortDataType.INT32));
        GraphFunction signature = new GraphFunction("divmod", "DivMod", null, parameters, null);
        SubGraph body = new SubGraph(List.of(NodeFactory.functionEntry(signature, "entry")), List.of());
        GraphFunction divMod = new GraphFunction("divmod", "DivMod", null, parameters, body);
        var graph = new GraphBuilder("Calc")
                .node(NodeTypes.START, "start")
                .node(NodeFactory.callFunction(divMod, "dm"))
                .node(NodeTypes.PRINT, "print")
                .exec("start", "dm")
                .exec("dm", "print")
                .data("dm", "q", "print", "string")
                .function(divMod)
                .build();

        GenerationResult result = generator.generate(graph, CodeGenOptions.defaults().withIncludeComments(false));

        assertTrue(result.success());
        assertThat(result.code())
                .contains("#include <tuple>")
                .contains("using DivModResult = std::tuple<int, int>;\nDivModResult DivMod(int x, int y) {\n    return DivModResult{0, 0};\n}")
                .contains("    auto result_dm = DivMod(0, 0);\n"
                        + "    auto q_dm = std::get<0>(result_dm);\n"
                        + "    auto r_dm = std::get<1>(result_dm);\n"
                        + "    std::cout << q_dm << std::endl;");
    }

    @Test
    @Tag("unit")
    void voidFunctionWithEmptyBodyReturnsPlainly() {
        GraphFunction signature = new GraphFunction("hello", "Say Hello", "Greets.", List.of(), null);
        GraphFunction hello = new GraphFunction("hello", "Say Hello", "Greets.", List.of(),
                new SubGraph(List.of(NodeFactory.functionEntry(signature, "entry")), List.of()));
        var graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(NodeFactory.callFunction(hello, "call"))
                .exec("start", "call")
                .function(hello)
                .build();

        GenerationResult result = generator.generate(graph, BARE.withIncludeComments(true));

        assertEquals("""
                // Greets.
                void Say_Hello() {
                    return;
                }

                // Call User Function: Say Hello
                Say_Hello();
                """, result.code());
    }

    @Test
    @Tag("unit")
    void callOfUnknownFunctionIsAnError() {
        Node call = withProperty(NodeFactory.create(NodeTypes.CALL_USER_FUNCTION, "call"), "functionId", "missing");
        var graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(call)
                .exec("start", "call")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertFalse(result.success());
        assertThat(result.errors())
                .extracting(Diagnostic::code, Diagnostic::nodeId)
                .containsExactly(tuple(CodeGenErrorCode.UNKNOWN_FUNCTION, "call"));
        assertThat(result.code()).contains("// Error: unknown function missing");
    }

    @Test
    @Tag("unit")
    void callWithoutFunctionIdIsAnError() {
        var graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(NodeTypes.CALL_USER_FUNCTION, "call")
                .exec("start", "call")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertFalse(result.success());
        assertEquals("// Error: no function selected\n", result.code());
    }

    @Test
    @Tag("unit")
    void returnNodeOutsideFunctionIsAnError() {
        Node ret = new Node("ret", NodeTypes.FUNCTION_RETURN, "", null,
                List.of(Port.input("ret-exec-in", PortDataType.EXECUTION)), List.of(), null, null);
        var graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .node(ret)
                .exec("start", "ret")
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertFalse(result.success());
        assertThat(result.errors()).extracting(Diagnostic::code).containsExactly(CodeGenErrorCode.UNKNOWN_FUNCTION);
        assertEquals("return;\n", result.code());
    }

    @Test
    @Tag("unit")
    void bodyDiagnosticsAreMergedIntoResult() {
        GraphFunction signature = new GraphFunction("f", "F", null, List.of(), null);
        Node badCall = withProperty(NodeFactory.create(NodeTypes.CALL_USER_FUNCTION, "inner"), "functionId", "nope");
        SubGraph body = new GraphBuilder("F")
                .node(NodeFactory.functionEntry(signature, "entry"))
                .node(badCall)
                .exec("entry", "inner")
                .buildBody();
        var graph = new GraphBuilder("g")
                .node(NodeTypes.START, "start")
                .function(new GraphFunction("f", "F", null, List.of(), body))
                .build();

        GenerationResult result = generator.generate(graph, BARE);

        assertFalse(result.success());
        assertThat(result.errors()).extracting(Diagnostic::nodeId).containsExactly("inner");
    }

    @Test
    @Tag("unit")
    void cyrillicFunctionNamesAreTransliterated() {
        GraphFunction f = new GraphFunction("f", "Привет", null, List.of(), null);

        assertEquals("Privet", FunctionSignatures.functionName(f));
        assertEquals("PrivetResult", FunctionSignatures.resultTypeName(f));
        assertEquals("void", FunctionSignatures.returnType(f));
        assertEquals("return;", FunctionSignatures.defaultReturn(f));
    }
}
