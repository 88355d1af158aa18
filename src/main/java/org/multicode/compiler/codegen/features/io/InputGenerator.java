package org.multicode.compiler.codegen.features.io;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.Identifiers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;
import org.multicode.graph.Port;

import java.util.Optional;

/**
 * Console input into a fresh {@code std::string}, preceded by the prompt when one is given.
 */
public class InputGenerator extends AbstractNodeGenerator {

    public InputGenerator() {
        super(NodeTypes.INPUT);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        Optional<String> prompt = helpers.input(node, "prompt");
        if (prompt.isPresent() && !"\"\"".equals(prompt.get())) {
            ctx.emit("std::cout << " + prompt.get() + ";");
        }
        String variable = variableName(node, ctx);
        ctx.emit("std::string " + variable + ";");
        ctx.emit("std::cin >> " + variable + ";");
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        if (Port.matchesKey(portId, "value")) {
            return Optional.of(variableName(node, ctx));
        }
        return Optional.of("\"\"");
    }

    private static String variableName(Node node, CodeGenContext ctx) {
        return ctx.variables()
                .bindName(node.id() + "-value", "input_" + Identifiers.nodeSuffix(node.id()), "Input Value",
                        "std::string", node.id())
                .codeName();
    }
}
