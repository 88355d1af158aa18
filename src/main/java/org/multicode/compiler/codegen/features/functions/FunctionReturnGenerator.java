package org.multicode.compiler.codegen.features.functions;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.CppTypes;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.diagnostics.CodeGenErrorCode;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.List;
import java.util.Optional;

/**
 * Returns the values wired into the output-parameter ports of a function body's return node.
 */
public class FunctionReturnGenerator extends AbstractNodeGenerator {

    public FunctionReturnGenerator() {
        super(NodeTypes.FUNCTION_RETURN);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<GraphFunction> function = ctx.currentFunction()
                .or(() -> node.property("functionId").flatMap(id -> ctx.program().findFunction(id)));
        if (function.isEmpty()) {
            ctx.error(CodeGenErrorCode.UNKNOWN_FUNCTION, node.id(), "Function return node outside of a function");
            ctx.emit("return;");
            return NodeGenerationResult.stop();
        }

        GraphFunction f = function.get();
        List<String> values = f.outputs().stream()
                .map(p -> helpers.input(node, p.id()).orElse(CppTypes.zeroValue(p.dataType())))
                .toList();
        if (FunctionSignatures.hasResultType(f)) {
            ctx.headers().requireTupleSupport();
        }
        ctx.emit(FunctionSignatures.returnStatement(f, values));
        return NodeGenerationResult.stop();
    }
}
