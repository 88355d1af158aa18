package org.multicode.compiler.codegen.features.flow;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.List;

/**
 * {@code switch} over the {@code case-N} outputs in numeric order, followed by {@code default}.
 */
public class SwitchGenerator extends AbstractNodeGenerator {

    public SwitchGenerator() {
        super(NodeTypes.SWITCH);
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        String selection = helpers.inputOr(node, "selection", "0");
        ctx.emit("switch (" + selection + ") {");

        List<Integer> cases = NumberedPorts.indices(node, "case-");
        for (int caseNumber : cases) {
            ctx.emit("case " + caseNumber + ":");
            ctx.pushIndent();
            helpers.traverseFrom(node, "case-" + caseNumber);
            ctx.emit("break;");
            ctx.popIndent();
        }

        ctx.emit("default:");
        ctx.pushIndent();
        helpers.traverseFrom(node, "default");
        ctx.emit("break;");
        ctx.popIndent();

        ctx.emit("}");
        return NodeGenerationResult.custom();
    }
}
