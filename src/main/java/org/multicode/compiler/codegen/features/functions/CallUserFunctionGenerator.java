package org.multicode.compiler.codegen.features.functions;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.CppTypes;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.VariableBinding;
import org.multicode.compiler.diagnostics.CodeGenErrorCode;
import org.multicode.graph.FunctionParameter;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Call of a user-defined function referenced by the {@code functionId} property.
 * <p>
 * A call with outputs stores the result in {@code result_<suffix>}; a multi-output result is
 * destructured into one variable per output parameter with {@code std::get}.
 */
public class CallUserFunctionGenerator extends AbstractNodeGenerator {

    static final String FUNCTION_ID = "functionId";

    public CallUserFunctionGenerator() {
        super(NodeTypes.CALL_USER_FUNCTION);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<String> functionId = node.property(FUNCTION_ID).filter(id -> !id.isBlank());
        if (functionId.isEmpty()) {
            ctx.error(CodeGenErrorCode.UNKNOWN_FUNCTION, node.id(), "Call node has no functionId");
            ctx.emit("// Error: no function selected");
            return NodeGenerationResult.follow();
        }
        Optional<GraphFunction> function = ctx.program().findFunction(functionId.get());
        if (function.isEmpty()) {
            ctx.error(CodeGenErrorCode.UNKNOWN_FUNCTION, node.id(), "Unknown function: " + functionId.get());
            ctx.emit("// Error: unknown function " + functionId.get());
            return NodeGenerationResult.follow();
        }

        GraphFunction f = function.get();
        List<String> args = new ArrayList<>();
        for (FunctionParameter parameter : f.inputs()) {
            args.add(helpers.input(node, parameter.id()).orElse(CppTypes.zeroValue(parameter.dataType())));
        }
        String call = FunctionSignatures.functionName(f) + "(" + String.join(", ", args) + ")";

        List<FunctionParameter> outputs = f.outputs();
        if (outputs.isEmpty()) {
            ctx.emit(call + ";");
            return NodeGenerationResult.follow();
        }

        String result = resultName(node, ctx);
        ctx.emit("auto " + result + " = " + call + ";");
        if (outputs.size() > 1) {
            ctx.headers().requireTupleSupport();
            for (int i = 0; i < outputs.size(); i++) {
                ctx.emit("auto " + outputName(node, outputs.get(i), ctx) + " = std::get<" + i + ">(" + result + ");");
            }
        }
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        String result = resultName(node, ctx);
        Optional<GraphFunction> function = node.property(FUNCTION_ID).flatMap(id -> ctx.program().findFunction(id));
        if (function.isEmpty() || function.get().outputs().size() <= 1) {
            return Optional.of(result);
        }
        List<FunctionParameter> outputs = function.get().outputs();
        for (FunctionParameter output : outputs) {
            if (portId.equals(output.id()) || Port.matchesKey(portId, output.id())) {
                return Optional.of(outputName(node, output, ctx));
            }
        }
        return Optional.of(result);
    }

    private static String resultName(Node node, CodeGenContext ctx) {
        return ctx.variables()
                .bindName(node.id() + "-result", "result_" + Identifiers.nodeSuffix(node.id()), "Result", "auto", node.id())
                .codeName();
    }

    private static String outputName(Node node, FunctionParameter output, CodeGenContext ctx) {
        VariableBinding binding = ctx.variables().bindName(
                node.id() + "-result-" + output.id(),
                Identifiers.toIdentifier(output.name()) + "_" + Identifiers.nodeSuffix(node.id()),
                output.name(), "auto", node.id());
        return binding.codeName();
    }
}
