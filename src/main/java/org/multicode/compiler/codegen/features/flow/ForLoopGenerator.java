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
 * Counting loop over {@code first..last} inclusive. The counter is exposed on the {@code index} output.
 */
public class ForLoopGenerator extends AbstractNodeGenerator {

    public ForLoopGenerator() {
        super(NodeTypes.FOR_LOOP);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String first = helpers.inputOr(node, "first", "0");
        String last = helpers.inputOr(node, "last", "10");
        String index = indexName(node, ctx);

        ctx.emit("for (int " + index + " = " + first + "; " + index + " <= " + last + "; " + index + "++) {");
        ctx.pushIndent();
        helpers.traverseFrom(node, "loop-body");
        ctx.popIndent();
        ctx.emit("}");
        return NodeGenerationResult.customThen("completed");
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        if (Port.matchesKey(portId, "index")) {
            return Optional.of(indexName(node, ctx));
        }
        return Optional.empty();
    }

    private static String indexName(Node node, CodeGenContext ctx) {
        return ctx.variables()
                .bindName(node.id() + "-index", "i_" + Identifiers.nodeSuffix(node.id()), "Index", "int", node.id())
                .codeName();
    }
}
