package org.multicode.compiler.codegen.features.variables;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.CppTypes;
import org.multicode.compiler.codegen.ExpressionResolver;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.codegen.VariableBinding;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;
import org.multicode.graph.PortDataType;

import java.util.Optional;

/**
 * Variable declaration {@code <type> name = <initial>;}. The declaration is emitted the first
 * time the variable is needed: when the node is visited or when its value is first read.
 */
public class VariableGenerator extends AbstractNodeGenerator {

    public VariableGenerator() {
        super(NodeTypes.VARIABLE);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        declare(node, ctx);
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        return Optional.of(declare(node, ctx).codeName());
    }

    private static VariableBinding declare(Node node, CodeGenContext ctx) {
        String variableId = VariableNodes.stableId(node);
        Optional<VariableBinding> existing = ctx.variables().lookup(variableId);
        if (existing.isPresent()) return existing.get();

        PortDataType type = node.findOutput("value").map(Port::dataType).orElse(PortDataType.FLOAT);
        String cppType = CppTypes.cppType(type);
        VariableBinding binding = ctx.variables().bind(variableId, VariableNodes.displayName(node), cppType, node.id());
        ctx.emit(cppType + " " + binding.codeName() + " = " + initialValue(node, type) + ";");
        return binding;
    }

    private static String initialValue(Node node, PortDataType type) {
        Object initial = node.properties().get("defaultValue");
        if (initial == null) {
            initial = node.findOutput("value").map(p -> p.value() != null ? p.value() : p.defaultValue()).orElse(null);
        }
        return initial != null ? ExpressionResolver.formatLiteral(initial, type) : CppTypes.zeroValue(type);
    }
}
