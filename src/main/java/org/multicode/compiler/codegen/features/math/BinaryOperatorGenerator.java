package org.multicode.compiler.codegen.features.math;

import org.multicode.compiler.codegen.AbstractNodeGenerator;
import org.multicode.compiler.codegen.CodeGenContext;
import org.multicode.compiler.codegen.GeneratorHelpers;
import org.multicode.compiler.codegen.NodeGenerationResult;
import org.multicode.compiler.diagnostics.CodeGenWarningCode;
import org.multicode.graph.Node;
import org.multicode.graph.NodeTypes;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure binary operator node: {@code (a op b)}. Emits no statements.
 * <p>
 * Division and modulo default the divisor to {@code 1} and warn when it is a literal zero.
 */
public class BinaryOperatorGenerator extends AbstractNodeGenerator {

    private static final Set<String> ZERO_LITERALS = Set.of("0", "0.0", "0.0f", "0LL");

    private final String operator;
    private final String defaultA;
    private final String defaultB;
    private final CodeGenWarningCode zeroDivisorWarning;

    /**
     * @param nodeType           The node type served.
     * @param operator           The C++ operator.
     * @param defaultA           Fallback for an unresolved left operand.
     * @param defaultB           Fallback for an unresolved right operand.
     * @param zeroDivisorWarning Warning raised for a literal zero right operand, or {@code null}.
     */
    public BinaryOperatorGenerator(String nodeType, String operator, String defaultA, String defaultB,
                                   CodeGenWarningCode zeroDivisorWarning) {
        super(nodeType);
        this.operator = operator;
        this.defaultA = defaultA;
        this.defaultB = defaultB;
        this.zeroDivisorWarning = zeroDivisorWarning;
    }

    /**
     * @return Generators for all arithmetic, comparison and binary logic node types.
     */
    public static List<BinaryOperatorGenerator> all() {
        return List.of(
                new BinaryOperatorGenerator(NodeTypes.ADD, "+", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.SUBTRACT, "-", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.MULTIPLY, "*", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.DIVIDE, "/", "0", "1", CodeGenWarningCode.DIVISION_BY_ZERO),
                new BinaryOperatorGenerator(NodeTypes.MODULO, "%", "0", "1", CodeGenWarningCode.MODULO_BY_ZERO),
                new BinaryOperatorGenerator(NodeTypes.EQUAL, "==", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.NOT_EQUAL, "!=", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.GREATER, ">", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.LESS, "<", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.GREATER_EQUAL, ">=", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.LESS_EQUAL, "<=", "0", "0", null),
                new BinaryOperatorGenerator(NodeTypes.AND, "&&", "false", "false", null),
                new BinaryOperatorGenerator(NodeTypes.OR, "||", "false", "false", null));
    }

    @Override
    public NodeGenerationResult generate(Node node, CodeGenContext ctx, GeneratorHelpers helpers) {
        return NodeGenerationResult.follow();
    }

    @Override
    public Optional<String> outputExpression(Node node, String portId, CodeGenContext ctx, GeneratorHelpers helpers) {
        String a = helpers.inputOr(node, "a", defaultA);
        String b = helpers.inputOr(node, "b", defaultB);
        if (zeroDivisorWarning != null && ZERO_LITERALS.contains(b)) {
            ctx.warnOnce(zeroDivisorWarning, node.id(), "Right operand of '" + operator + "' is zero");
        }
        return Optional.of("(" + a + " " + operator + " " + b + ")");
    }
}
