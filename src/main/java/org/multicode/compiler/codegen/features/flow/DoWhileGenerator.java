package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * {@code do { ... } while (cond);}
 */
public class DoWhileGenerator extends AbstractNodeGenerator {

    public DoWhileGenerator() {
        super(NodeTypes.DO_WHILE);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String condition = helpers.inputOr(node, "condition", "true");
        ctx.emit("do {");
        ctx.pushIndent();
        helpers.traverseFrom(node, "loop-body");
        ctx.popIndent();
        ctx.emit("} while (" + condition + ");");
        return NodeGenerationResult.customThen("completed");
    }
}
