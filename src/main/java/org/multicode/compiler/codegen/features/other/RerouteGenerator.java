package org.multicode.compiler.codegen.features.other;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.Optional;

/**
 * Pass-through for wiring: the output is the expression of the {@code in} input.
 */
public class RerouteGenerator extends AbstractNodeGenerator {

    public RerouteGenerator() {
        super(NodeTypes.REROUTE);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        return Optional.of(helpers.inputOr(node, "in", "0"));
    }
}
