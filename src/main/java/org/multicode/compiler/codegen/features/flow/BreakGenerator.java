package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

public class BreakGenerator extends AbstractNodeGenerator {

    public BreakGenerator() {
        super(NodeTypes.BREAK);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        ctx.emit("break;");
        return NodeGenerationResult.stop();
    }
}
