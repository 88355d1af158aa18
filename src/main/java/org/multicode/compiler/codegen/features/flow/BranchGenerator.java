package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * {@code if (cond) { ... } else { ... }}. The else part is omitted when {@code false} is unconnected.
 */
public class BranchGenerator extends AbstractNodeGenerator {

    public BranchGenerator() {
        super(NodeTypes.BRANCH);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String condition = helpers.inputOr(node, "condition", "true");
        ctx.emit("if (" + condition + ") {");

        ctx.pushIndent();
        if (!helpers.traverseFrom(node, "true")) {
            ctx.emit("// Empty branch");
            ctx.warn(CodeGenWarningCode.EMPTY_BRANCH, node.id(), "Branch 'True' is empty");
        }
        ctx.popIndent();

        if (helpers.executionTarget(node, "false").isPresent()) {
            ctx.emit("} else {");
            ctx.pushIndent();
            helpers.traverseFrom(node, "false");
            ctx.popIndent();
        }
        ctx.emit("}");
        return NodeGenerationResult.custom();
    }
}
