package org.multicode.compiler.codegen.features.other;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * Placeholder for node types without C++ semantics: leaves a TODO line in the output.
 */
public class FallbackGenerator extends AbstractNodeGenerator {

    public FallbackGenerator() {
        super(NodeTypes.CUSTOM, NodeTypes.FUNCTION, NodeTypes.FUNCTION_CALL, NodeTypes.EVENT);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        ctx.emit("// TODO: " + node.type() + " - " + node.label());
        return NodeGenerationResult.follow();
    }
}
