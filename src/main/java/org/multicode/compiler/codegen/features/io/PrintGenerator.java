package org.multicode.compiler.codegen.features.io;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

/**
 * Console output: {@code std::cout << expr << std::endl;}
 */
public class PrintGenerator extends AbstractNodeGenerator {

    public PrintGenerator() {
        super(NodeTypes.PRINT);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String text = helpers.inputOr(node, "string", "\"\"");
        ctx.emit("std::cout << " + text + " << std::endl;");
        return NodeGenerationResult.follow();
    }
}
