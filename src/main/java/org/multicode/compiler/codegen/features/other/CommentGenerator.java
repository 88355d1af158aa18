package org.multicode.compiler.codegen.features.other;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * Emits the node's comment, or its label, as {@code //} lines. Comment nodes never continue
 * the execution flow and are exempt from the unused-node check.
 */
public class CommentGenerator extends AbstractNodeGenerator {

    public CommentGenerator() {
        super(NodeTypes.COMMENT);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String text = node.comment() != null ? node.comment() : node.label();
        if (!text.isEmpty()) {
            for (String line : text.split("\\r?\\n", -1)) {
                ctx.emit("// " + line);
            }
        }
        return NodeGenerationResult.stop();
    }
}
