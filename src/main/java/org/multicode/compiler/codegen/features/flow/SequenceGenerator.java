package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * Runs the {@code then-N} outputs one after another, in numeric order.
 */
public class SequenceGenerator extends AbstractNodeGenerator {

    public SequenceGenerator() {
        super(NodeTypes.SEQUENCE);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        for (int index : NumberedPorts.indices(node, "then-")) {
            helpers.traverseFrom(node, "then-" + index);
        }
        return NodeGenerationResult.custom();
    }
}
