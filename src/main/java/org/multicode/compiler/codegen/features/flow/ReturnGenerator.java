package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.features.functions.FunctionSignatures;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.Optional;

/**
 * {@code End} and {@code Return}: {@code return <value>;}. Without a value the main program
 * returns {@code 0} and a function body returns the default of its outputs ({@code return;}
 * for void functions).
 */
public class ReturnGenerator extends AbstractNodeGenerator {

    public ReturnGenerator() {
        super(NodeTypes.END, NodeTypes.RETURN);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<String> value = helpers.input(node, "value");
        Optional<GraphFunction> function = ctx.currentFunction();
        if (function.isPresent() && (value.isEmpty() || function.get().outputs().isEmpty())) {
            if (FunctionSignatures.hasResultType(function.get())) {
                ctx.headers().requireTupleSupport();
            }
            ctx.emit(FunctionSignatures.defaultReturn(function.get()));
        } else {
            ctx.emit("return " + value.orElse("0") + ";");
        }
        return NodeGenerationResult.stop();
    }
}
