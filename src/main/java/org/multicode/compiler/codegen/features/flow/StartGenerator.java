package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * The entry node emits nothing and starts the execution flow.
 */
public class StartGenerator extends AbstractNodeGenerator {

    public StartGenerator() {
        super(NodeTypes.START);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        return NodeGenerationResult.follow();
    }
}
