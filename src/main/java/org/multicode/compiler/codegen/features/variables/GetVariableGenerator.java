package org.multicode.compiler.codegen.features.variables;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.VariableBinding;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.Optional;

/**
 * Pure read of a variable. A variable declared by a {@code Variable} node of the same scope is
 * declared on first read; reading a variable that has no declaration yet is reported.
 */
public class GetVariableGenerator extends AbstractNodeGenerator {

    public GetVariableGenerator() {
        super(NodeTypes.GET_VARIABLE);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        String variableId = VariableNodes.stableId(node);
        Optional<VariableBinding> binding = ctx.variables().lookup(variableId);
        if (binding.isPresent()) {
            return Optional.of(binding.get().codeName());
        }
        Optional<Node> declaration = ctx.graph().nodesOfType(NodeTypes.VARIABLE).stream()
                .filter(v -> VariableNodes.stableId(v).equals(variableId))
                .findFirst();
        if (declaration.isPresent()) {
            ctx.markConsumed(declaration.get().id());
            return Optional.of(helpers.output(declaration.get(), "value"));
        }
        String name = VariableNodes.displayName(node);
        ctx.warnOnce(CodeGenWarningCode.UNINITIALIZED_VARIABLE, node.id(),
                "Variable '" + name + "' is read before it is set");
        return Optional.of(Identifiers.toIdentifier(name));
    }
}
