package org.multicode.graph;

import org.multicode.graph.NodeTypeDefinition.PortTemplate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.multicode.graph.NodeTypeDefinition.PortTemplate.exec;
import static org.multicode.graph.NodeTypeDefinition.PortTemplate.of;
import static org.multicode.graph.PortDataType.ANY;
import static org.multicode.graph.PortDataType.ARRAY;
import static org.multicode.graph.PortDataType.BOOL;
import static org.multicode.graph.PortDataType.FLOAT;
import static org.multicode.graph.PortDataType.INT32;
import static org.multicode.graph.PortDataType.OBJECT;
import static org.multicode.graph.PortDataType.STRING;

/**
 * The built-in node types: their tags and the definitions used to create nodes and to look up
 * default labels.
 */
public final class NodeTypes {

    // flow
    public static final String START = "Start";
    public static final String END = "End";
    public static final String BRANCH = "Branch";
    public static final String FOR_LOOP = "ForLoop";
    public static final String WHILE_LOOP = "WhileLoop";
    public static final String DO_WHILE = "DoWhile";
    public static final String FOR_EACH = "ForEach";
    public static final String SWITCH = "Switch";
    public static final String SEQUENCE = "Sequence";
    public static final String BREAK = "Break";
    public static final String CONTINUE = "Continue";
    public static final String RETURN = "Return";

    // functions
    public static final String FUNCTION = "Function";
    public static final String FUNCTION_CALL = "FunctionCall";
    public static final String EVENT = "Event";
    public static final String FUNCTION_ENTRY = "FunctionEntry";
    public static final String FUNCTION_RETURN = "FunctionReturn";
    public static final String CALL_USER_FUNCTION = "CallUserFunction";

    // variables
    public static final String VARIABLE = "Variable";
    public static final String GET_VARIABLE = "GetVariable";
    public static final String SET_VARIABLE = "SetVariable";

    // math
    public static final String ADD = "Add";
    public static final String SUBTRACT = "Subtract";
    public static final String MULTIPLY = "Multiply";
    public static final String DIVIDE = "Divide";
    public static final String MODULO = "Modulo";

    // comparison
    public static final String EQUAL = "Equal";
    public static final String NOT_EQUAL = "NotEqual";
    public static final String GREATER = "Greater";
    public static final String LESS = "Less";
    public static final String GREATER_EQUAL = "GreaterEqual";
    public static final String LESS_EQUAL = "LessEqual";

    // logic
    public static final String AND = "And";
    public static final String OR = "Or";
    public static final String NOT = "Not";

    // io
    public static final String PRINT = "Print";
    public static final String INPUT = "Input";

    // other
    public static final String COMMENT = "Comment";
    public static final String REROUTE = "Reroute";
    public static final String CUSTOM = "Custom";

    private static final Map<String, NodeTypeDefinition> DEFINITIONS = new LinkedHashMap<>();

    static {
        define(START, "Event Begin Play", NodeCategory.FLOW, List.of(), List.of(exec("exec-out")));
        define(END, "Return", NodeCategory.FLOW, List.of(exec("exec-in")), List.of());
        define(BRANCH, "Branch", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("condition", "Condition", BOOL)),
                List.of(exec("true"), exec("false")));
        define(FOR_LOOP, "For Loop", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("first", "First Index", INT32, 0), of("last", "Last Index", INT32, 10)),
                List.of(exec("loop-body"), of("index", "Index", INT32), exec("completed")));
        define(WHILE_LOOP, "While Loop", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("condition", "Condition", BOOL)),
                List.of(exec("loop-body"), exec("completed")));
        define(SEQUENCE, "Sequence", NodeCategory.FLOW,
                List.of(exec("exec-in")),
                List.of(exec("then-0"), exec("then-1")));
        define(DO_WHILE, "Do While", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("condition", "Condition", BOOL)),
                List.of(exec("loop-body"), exec("completed")));
        define(FOR_EACH, "For Each", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("array", "Array", ARRAY)),
                List.of(exec("loop-body"), of("element", "Element", ANY), of("index", "Index", INT32), exec("completed")));
        define(SWITCH, "Switch", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("selection", "Selection", INT32, 0)),
                List.of(exec("case-0"), exec("case-1"), exec("default")));
        define(BREAK, "Break", NodeCategory.FLOW, List.of(exec("exec-in")), List.of());
        define(CONTINUE, "Continue", NodeCategory.FLOW, List.of(exec("exec-in")), List.of());
        define(RETURN, "Return", NodeCategory.FLOW,
                List.of(exec("exec-in"), of("value", "Return Value", ANY)), List.of());

        define(FUNCTION, "Function", NodeCategory.FUNCTION, List.of(exec("exec-in")), List.of(exec("exec-out")));
        define(FUNCTION_CALL, "Call Function", NodeCategory.FUNCTION,
                List.of(exec("exec-in"), of("target", "Target", OBJECT)),
                List.of(exec("exec-out"), of("return", "Return Value", ANY)));
        define(EVENT, "Custom Event", NodeCategory.FUNCTION, List.of(), List.of(exec("exec-out")));
        define(FUNCTION_ENTRY, "Function Entry", NodeCategory.FUNCTION, List.of(), List.of(exec("exec-out")));
        define(FUNCTION_RETURN, "Function Return", NodeCategory.FUNCTION, List.of(exec("exec-in")), List.of());
        define(CALL_USER_FUNCTION, "Call User Function", NodeCategory.FUNCTION,
                List.of(exec("exec-in")), List.of(exec("exec-out")));

        define(VARIABLE, "Variable", NodeCategory.VARIABLE, List.of(), List.of(of("value", "Value", ANY)));
        define(GET_VARIABLE, "Get", NodeCategory.VARIABLE, List.of(), List.of(of("value", "", ANY)));
        define(SET_VARIABLE, "Set", NodeCategory.VARIABLE,
                List.of(exec("exec-in"), of("value", "", ANY)),
                List.of(exec("exec-out"), of("value", "", ANY)));

        binary(ADD, "Add", NodeCategory.MATH, FLOAT, FLOAT, 0, 0);
        binary(SUBTRACT, "Subtract", NodeCategory.MATH, FLOAT, FLOAT, 0, 0);
        binary(MULTIPLY, "Multiply", NodeCategory.MATH, FLOAT, FLOAT, 0, 0);
        binary(DIVIDE, "Divide", NodeCategory.MATH, FLOAT, FLOAT, 0, 1);
        binary(MODULO, "Modulo", NodeCategory.MATH, INT32, INT32, 0, 1);

        binary(EQUAL, "==", NodeCategory.COMPARISON, ANY, BOOL, null, null);
        binary(NOT_EQUAL, "!=", NodeCategory.COMPARISON, ANY, BOOL, null, null);
        binary(GREATER, ">", NodeCategory.COMPARISON, FLOAT, BOOL, null, null);
        binary(LESS, "<", NodeCategory.COMPARISON, FLOAT, BOOL, null, null);
        binary(GREATER_EQUAL, ">=", NodeCategory.COMPARISON, FLOAT, BOOL, null, null);
        binary(LESS_EQUAL, "<=", NodeCategory.COMPARISON, FLOAT, BOOL, null, null);

        binary(AND, "AND", NodeCategory.LOGIC, BOOL, BOOL, null, null);
        binary(OR, "OR", NodeCategory.LOGIC, BOOL, BOOL, null, null);
        define(NOT, "NOT", NodeCategory.LOGIC, List.of(of("a", "", BOOL)), List.of(of("result", "", BOOL)));

        define(PRINT, "Print String", NodeCategory.IO,
                List.of(exec("exec-in"), of("string", "In String", STRING, "")),
                List.of(exec("exec-out")));
        define(INPUT, "Read Input", NodeCategory.IO,
                List.of(exec("exec-in"), of("prompt", "Prompt", STRING, "")),
                List.of(exec("exec-out"), of("value", "Value", STRING)));

        define(COMMENT, "Comment", NodeCategory.OTHER, List.of(), List.of());
        define(REROUTE, "Reroute", NodeCategory.OTHER, List.of(of("in", "", ANY)), List.of(of("out", "", ANY)));
        define(CUSTOM, "Custom Node", NodeCategory.OTHER, List.of(exec("exec-in")), List.of(exec("exec-out")));
    }

    private NodeTypes() {}

    private static void define(String type, String label, NodeCategory category,
                               List<PortTemplate> inputs, List<PortTemplate> outputs) {
        DEFINITIONS.put(type, new NodeTypeDefinition(type, label, category, inputs, outputs));
    }

    private static void binary(String type, String label, NodeCategory category,
                               PortDataType operandType, PortDataType resultType, Object defaultA, Object defaultB) {
        define(type, label, category,
                List.of(of("a", "A", operandType, defaultA), of("b", "B", operandType, defaultB)),
                List.of(of("result", "Result", resultType)));
    }

    /**
     * @param type A node-type tag.
     * @return The definition of a built-in type.
     */
    public static Optional<NodeTypeDefinition> definition(String type) {
        return Optional.ofNullable(DEFINITIONS.get(type));
    }

    /**
     * @param type A node-type tag.
     * @return The default label of the type, or the tag itself for unknown types.
     */
    public static String defaultLabel(String type) {
        NodeTypeDefinition def = DEFINITIONS.get(type);
        return def != null ? def.label() : type;
    }

    /**
     * @return All built-in definitions in catalogue order.
     */
    public static Collection<NodeTypeDefinition> all() {
        return Collections.unmodifiableCollection(DEFINITIONS.values());
    }

    /**
     * @param category A palette category.
     * @return The definitions of that category in catalogue order.
     */
    public static List<NodeTypeDefinition> byCategory(NodeCategory category) {
        return DEFINITIONS.values().stream().filter(d -> d.category() == category).toList();
    }
}
