package org.multicode.compiler.codegen.features.functions;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.VariableBinding;
import org.multicode.graph.FunctionParameter;
import org.multicode.graph.GraphFunction;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;

import java.util.Optional;

/**
 * Entry of a function body. The signature is written by the function synthesizer; here the
 * node only exposes the input parameters to data edges.
 */
public class FunctionEntryGenerator extends AbstractNodeGenerator {

    public FunctionEntryGenerator() {
        super(NodeTypes.FUNCTION_ENTRY);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<GraphFunction> function = ctx.currentFunction();
        if (function.isEmpty()) return Optional.empty();
        for (FunctionParameter parameter : function.get().inputs()) {
            if (portId.equals(parameter.id()) || Port.matchesKey(portId, parameter.id())) {
                return Optional.of(ctx.variables()
                        .lookup(FunctionSignatures.parameterVariableId(parameter))
                        .map(VariableBinding::codeName)
                        .orElseGet(() -> Identifiers.toIdentifier(parameter.name())));
            }
        }
        return Optional.empty();
    }
}
