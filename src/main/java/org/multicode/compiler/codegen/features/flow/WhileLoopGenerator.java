package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * {@code while (cond) { ... }}. A condition that is the literal {@code true} raises an
 * infinite-loop warning.
 */
public class WhileLoopGenerator extends AbstractNodeGenerator {

    public WhileLoopGenerator() {
        super(NodeTypes.WHILE_LOOP);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String condition = helpers.inputOr(node, "condition", "true");
        if ("true".equals(condition)) {
            ctx.warn(CodeGenWarningCode.INFINITE_LOOP, node.id(), "Loop condition is always true");
        }
        ctx.emit("while (" + condition + ") {");
        ctx.pushIndent();
        helpers.traverseFrom(node, "loop-body");
        ctx.popIndent();
        ctx.emit("}");
        return NodeGenerationResult.customThen("completed");
    }
}
