package org.multicode.compiler.codegen.features.variables;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.CppTypes;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.VariableBinding;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;
import org.multicode.graph.PortDataType;

import java.util.Optional;

/**
 * Assignment. The first assignment of a logical variable declares it with a type, later ones
 * reassign it.
 */
public class SetVariableGenerator extends AbstractNodeGenerator {

    public SetVariableGenerator() {
        super(NodeTypes.SET_VARIABLE);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String value = helpers.inputOr(node, "value", "0");
        String variableId = VariableNodes.stableId(node);
        Optional<VariableBinding> existing = ctx.variables().lookup(variableId);
        if (existing.isPresent()) {
            ctx.emit(existing.get().codeName() + " = " + value + ";");
        } else {
            PortDataType type = node.findInput("value").map(Port::dataType).orElse(PortDataType.FLOAT);
            String cppType = CppTypes.cppType(type);
            VariableBinding binding = ctx.variables().bind(variableId, VariableNodes.displayName(node), cppType, node.id());
            ctx.emit(cppType + " " + binding.codeName() + " = " + value + ";");
        }
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        return Optional.of(ctx.variables().lookup(VariableNodes.stableId(node))
                .map(VariableBinding::codeName)
                .orElseGet(() -> Identifiers.toIdentifier(VariableNodes.displayName(node))));
    }
}
