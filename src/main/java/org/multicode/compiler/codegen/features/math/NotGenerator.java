package org.multicode.compiler.codegen.features.math;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.Optional;

/**
 * Pure logical negation: {@code (!a)}.
 */
public class NotGenerator extends AbstractNodeGenerator {

    public NotGenerator() {
        super(NodeTypes.NOT);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        return Optional.of("(!" + helpers.inputOr(node, "a", "false") + ")");
    }
}
