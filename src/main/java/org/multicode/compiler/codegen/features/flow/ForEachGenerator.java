package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;

import java.util.Optional;

/**
 * Range-based loop with a separate index counter.
 */
public class ForEachGenerator extends AbstractNodeGenerator {

    public ForEachGenerator() {
        super(NodeTypes.FOR_EACH);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String array = helpers.inputOr(node, "array", "items");
        String index = indexName(node, ctx);
        String element = elementName(node, ctx);

        ctx.emit("int " + index + " = 0;");
        ctx.emit("for (const auto& " + element + " : " + array + ") {");
        ctx.pushIndent();
        helpers.traverseFrom(node, "loop-body");
        ctx.emit(index + "++;");
        ctx.popIndent();
        ctx.emit("}");
        return NodeGenerationResult.customThen("completed");
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        if (Port.matchesKey(portId, "element")) return Optional.of(elementName(node, ctx));
        if (Port.matchesKey(portId, "index")) return Optional.of(indexName(node, ctx));
        return Optional.empty();
    }

    private static String indexName(Node node, CodeGenContext ctx) {
        return ctx.variables()
                .bindName(node.id() + "-index", "i_" + Identifiers.nodeSuffix(node.id()), "Index", "int", node.id())
                .codeName();
    }

    private static String elementName(Node node, CodeGenContext ctx) {
        return ctx.variables()
                .bindName(node.id() + "-element", "elem_" + Identifiers.nodeSuffix(node.id()), "Element", "auto", node.id())
                .codeName();
    }
}
